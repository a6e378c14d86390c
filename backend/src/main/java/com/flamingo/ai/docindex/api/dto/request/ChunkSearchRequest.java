package com.flamingo.ai.docindex.api.dto.request;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.domain.enums.RetrievalStrategy;
import com.flamingo.ai.docindex.service.retrieval.RetrievalOptions;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for searching the chunks of a project. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkSearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Defaults to hybrid. */
  private RetrievalStrategy strategy;

  @Min(value = 1, message = "maxResults must be at least 1")
  @Max(value = 100, message = "maxResults must not exceed 100")
  private Integer maxResults;

  @DecimalMin(value = "0.0", message = "similarityThreshold must be at least 0")
  @DecimalMax(value = "1.0", message = "similarityThreshold must not exceed 1")
  private Double similarityThreshold;

  private Boolean includeContext;

  @Min(value = 0, message = "contextWindow must not be negative")
  @Max(value = 10, message = "contextWindow must not exceed 10")
  private Integer contextWindow;

  private String documentId;
  private String headingPath;
  private ChunkType chunkType;
  private Integer hierarchyLevel;

  public RetrievalStrategy strategyOrDefault() {
    return strategy == null ? RetrievalStrategy.HYBRID : strategy;
  }

  /** Applies the request's settings to the server defaults. */
  public RetrievalOptions toOptions(RetrievalOptions defaults) {
    RetrievalOptions.RetrievalOptionsBuilder builder =
        defaults.toBuilder()
            .documentId(documentId)
            .headingPath(headingPath)
            .chunkType(chunkType)
            .hierarchyLevel(hierarchyLevel);
    if (maxResults != null) {
      builder.maxResults(maxResults);
    }
    if (similarityThreshold != null) {
      builder.similarityThreshold(similarityThreshold);
    }
    if (includeContext != null) {
      builder.includeContext(includeContext);
    }
    if (contextWindow != null) {
      builder.contextWindow(contextWindow);
    }
    return builder.build();
  }
}
