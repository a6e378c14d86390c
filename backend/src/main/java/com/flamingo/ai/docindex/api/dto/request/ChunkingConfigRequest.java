package com.flamingo.ai.docindex.api.dto.request;

import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chunking overrides sent with a request. Omitted fields keep the server defaults; the combined
 * config is validated by {@link ChunkingConfig#validate()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkingConfigRequest {

  private Integer minChunkSize;
  private Integer maxChunkSize;
  private Integer targetChunkSize;
  private Integer overlapPercentage;
  private Boolean preferSemanticBoundaries;
  private Boolean respectSectionBoundaries;
  private Boolean includeHeadingContext;
  private Boolean adaptiveSizing;

  /** Applies the overrides to a base config. */
  public ChunkingConfig toConfig(ChunkingConfig defaults) {
    ChunkingConfig.ChunkingConfigBuilder builder = defaults.toBuilder();
    if (minChunkSize != null) {
      builder.minChunkSize(minChunkSize);
    }
    if (maxChunkSize != null) {
      builder.maxChunkSize(maxChunkSize);
    }
    if (targetChunkSize != null) {
      builder.targetChunkSize(targetChunkSize);
    }
    if (overlapPercentage != null) {
      builder.overlapPercentage(overlapPercentage);
    }
    if (preferSemanticBoundaries != null) {
      builder.preferSemanticBoundaries(preferSemanticBoundaries);
    }
    if (respectSectionBoundaries != null) {
      builder.respectSectionBoundaries(respectSectionBoundaries);
    }
    if (includeHeadingContext != null) {
      builder.includeHeadingContext(includeHeadingContext);
    }
    if (adaptiveSizing != null) {
      builder.adaptiveSizing(adaptiveSizing);
    }
    return builder.build();
  }
}
