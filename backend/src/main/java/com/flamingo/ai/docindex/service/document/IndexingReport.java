package com.flamingo.ai.docindex.service.document;

import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import lombok.Builder;
import lombok.Value;

/** Outcome of indexing one document. */
@Value
@Builder
public class IndexingReport {

  static final String PROCESSED = "Processed successfully";
  static final String PROCESSED_DEGRADED = "Processed with reduced quality";

  String projectId;
  String documentId;
  ChunkingResult chunking;

  /** Chunks of an earlier version of the document that were replaced. */
  long replacedChunks;

  /** True when fallback embeddings were used for boundary analysis or chunk vectors. */
  boolean degraded;

  String message;
}
