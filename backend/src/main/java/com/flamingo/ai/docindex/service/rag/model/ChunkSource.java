package com.flamingo.ai.docindex.service.rag.model;

/**
 * Identifies the file a document was extracted from.
 *
 * @param fileId source file id, may be {@code null}
 * @param fileName source file name, may be {@code null}
 */
public record ChunkSource(String fileId, String fileName) {

  public static ChunkSource unknown() {
    return new ChunkSource(null, null);
  }
}
