package com.flamingo.ai.docindex.service.rag.embedding;

import java.util.List;

/**
 * Text-to-vector collaborator used by boundary detection, indexing and retrieval.
 *
 * <p>Implementations return unit-length vectors of {@link #dimensions()} elements, in the same
 * order as their input. They degrade rather than fail: when the provider is unavailable a
 * deterministic local vector is substituted and counted in {@link EmbeddingBatch#fallbackCount()}.
 */
public interface TextEmbedder {

  /**
   * Embeds document passages.
   *
   * @param texts passages in document order
   * @return one vector per passage, in input order
   */
  EmbeddingBatch embedPassages(List<String> texts);

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return the query vector
   */
  float[] embedQuery(String query);

  int dimensions();
}
