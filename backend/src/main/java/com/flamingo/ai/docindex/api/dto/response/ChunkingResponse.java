package com.flamingo.ai.docindex.api.dto.response;

import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunking run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkingResponse {

  private List<DocumentChunk> chunks;
  private Integer totalChunks;
  private Integer totalTokens;
  private Double averageChunkSize;
  private Double overlapEfficiency;
  private Double semanticCoherence;
  private Double hierarchyPreservation;
  private ChunkingConfig effectiveConfig;
  private Boolean degraded;

  /** Creates a ChunkingResponse from a chunking result. */
  public static ChunkingResponse fromResult(ChunkingResult result) {
    return ChunkingResponse.builder()
        .chunks(result.getChunks())
        .totalChunks(result.getTotalChunks())
        .totalTokens(result.getTotalTokens())
        .averageChunkSize(result.getAverageChunkSize())
        .overlapEfficiency(result.getOverlapEfficiency())
        .semanticCoherence(result.getSemanticCoherence())
        .hierarchyPreservation(result.getHierarchyPreservation())
        .effectiveConfig(result.getEffectiveConfig())
        .degraded(result.isDegraded())
        .build();
  }
}
