package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.service.rag.model.ChunkSource;
import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;

/** Turns raw document text into size-bounded, linked chunks. */
public interface DocumentChunker {

  /**
   * Chunks a document.
   *
   * @param text raw extracted text; blank text yields an empty result
   * @param documentId id of the document, used as the chunk id prefix
   * @param source the file the text came from
   * @param config run configuration, validated before any work is done
   * @return the chunks and quality metrics
   * @throws com.flamingo.ai.docindex.exception.InvalidChunkingConfigException if the config has
   *     inverted bounds
   */
  ChunkingResult chunkDocument(
      String text, String documentId, ChunkSource source, ChunkingConfig config);
}
