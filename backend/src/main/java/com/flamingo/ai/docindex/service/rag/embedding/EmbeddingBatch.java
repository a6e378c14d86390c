package com.flamingo.ai.docindex.service.rag.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Vectors for a list of texts plus how many of them came from the local fallback.
 *
 * @param vectors one vector per input text, in input order
 * @param fallbackCount number of vectors produced by the fallback generator
 */
public record EmbeddingBatch(List<float[]> vectors, int fallbackCount) {

  public static EmbeddingBatch empty() {
    return new EmbeddingBatch(List.of(), 0);
  }

  public boolean degraded() {
    return fallbackCount > 0;
  }

  public int size() {
    return vectors.size();
  }

  /** Concatenates batches in order. */
  public static EmbeddingBatch concat(List<EmbeddingBatch> batches) {
    List<float[]> all = new ArrayList<>();
    int fallbacks = 0;
    for (EmbeddingBatch batch : batches) {
      all.addAll(batch.vectors());
      fallbacks += batch.fallbackCount();
    }
    return new EmbeddingBatch(List.copyOf(all), fallbacks);
  }
}
