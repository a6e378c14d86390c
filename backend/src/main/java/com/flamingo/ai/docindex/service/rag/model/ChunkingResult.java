package com.flamingo.ai.docindex.service.rag.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Chunks of one document together with the quality metrics of the run. */
@Value
@Builder
public class ChunkingResult {

  List<DocumentChunk> chunks;
  int totalChunks;
  int totalTokens;
  double averageChunkSize;

  /** Fraction of adjacent chunk pairs that received overlap text. */
  double overlapEfficiency;

  /** Mean chunk semantic density. */
  double semanticCoherence;

  /** Fraction of adjacent chunk pairs whose heading paths are related. */
  double hierarchyPreservation;

  /** Size profile the chunks were actually cut with. */
  ChunkingConfig effectiveConfig;

  /** True when fallback embeddings were used anywhere in the run. */
  boolean degraded;

  public static ChunkingResult empty(ChunkingConfig config) {
    return ChunkingResult.builder()
        .chunks(List.of())
        .totalChunks(0)
        .totalTokens(0)
        .averageChunkSize(0.0)
        .overlapEfficiency(0.0)
        .semanticCoherence(0.0)
        .hierarchyPreservation(1.0)
        .effectiveConfig(config)
        .degraded(false)
        .build();
  }
}
