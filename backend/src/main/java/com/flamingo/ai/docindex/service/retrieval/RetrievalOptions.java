package com.flamingo.ai.docindex.service.retrieval;

import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.domain.enums.ChunkType;
import lombok.Builder;
import lombok.Value;

/** Per-request retrieval settings. Filter fields left {@code null} do not restrict. */
@Value
@Builder(toBuilder = true)
public class RetrievalOptions {

  @Builder.Default int maxResults = 10;
  @Builder.Default double similarityThreshold = 0.5;

  /** Attach neighbouring chunks to every hit, as the contextual strategy always does. */
  boolean includeContext;

  @Builder.Default int contextWindow = 2;

  String documentId;

  /** Case-insensitive substring of the heading path. */
  String headingPath;

  ChunkType chunkType;
  Integer hierarchyLevel;

  public static RetrievalOptions defaults(RagConfig.Retrieval properties) {
    return RetrievalOptions.builder()
        .maxResults(properties.getMaxResults())
        .similarityThreshold(properties.getSimilarityThreshold())
        .contextWindow(properties.getContextWindow())
        .build();
  }
}
