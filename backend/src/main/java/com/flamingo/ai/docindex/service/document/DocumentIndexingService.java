package com.flamingo.ai.docindex.service.document;

import com.flamingo.ai.docindex.exception.DocumentProcessingException;
import com.flamingo.ai.docindex.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.docindex.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docindex.service.rag.embedding.TextEmbedder;
import com.flamingo.ai.docindex.service.rag.model.ChunkSource;
import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.ChunkingResult;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.store.ChunkVectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chunks a document, embeds its chunks and replaces the document's chunks in the store.
 *
 * <p>Chunking and embedding finish before the store is touched. If storing fails, whatever was
 * written for the document is removed again so a partial chunk set is never left behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIndexingService {

  private final DocumentChunker documentChunker;
  private final TextEmbedder textEmbedder;
  private final ChunkVectorStore chunkStore;
  private final MeterRegistry meterRegistry;

  /**
   * Indexes a document, replacing any chunks stored for it before.
   *
   * @param projectId owning project
   * @param documentId document id, also the prefix of the chunk ids
   * @param text extracted document text
   * @param source file the text came from
   * @param config chunking configuration
   * @return the chunking metrics and whether a fallback path was used
   * @throws DocumentProcessingException if the chunks could not be stored
   */
  @Timed(value = "document.index", description = "Time to chunk, embed and store a document")
  public IndexingReport indexDocument(
      String projectId,
      String documentId,
      String text,
      ChunkSource source,
      ChunkingConfig config) {
    ChunkingResult result = documentChunker.chunkDocument(text, documentId, source, config);
    List<DocumentChunk> chunks = result.getChunks();

    List<String> texts = chunks.stream().map(DocumentIndexingService::embeddingText).toList();
    EmbeddingBatch vectors = textEmbedder.embedPassages(texts);
    boolean degraded = result.isDegraded() || vectors.degraded();

    long replaced = chunkStore.deleteByDocument(projectId, documentId);
    try {
      chunkStore.upsert(projectId, chunks, vectors.vectors());
    } catch (RuntimeException e) {
      meterRegistry.counter("document.index.failures").increment();
      removePartialWrite(projectId, documentId, e);
      throw new DocumentProcessingException(
          documentId, "Failed to store " + chunks.size() + " chunks", e);
    }

    meterRegistry.counter("document.indexed", "degraded", String.valueOf(degraded)).increment();
    log.info(
        "Indexed document {} in project {}: {} chunks, {} replaced{}",
        documentId,
        projectId,
        chunks.size(),
        replaced,
        degraded ? ", reduced quality" : "");
    return IndexingReport.builder()
        .projectId(projectId)
        .documentId(documentId)
        .chunking(result)
        .replacedChunks(replaced)
        .degraded(degraded)
        .message(degraded ? IndexingReport.PROCESSED_DEGRADED : IndexingReport.PROCESSED)
        .build();
  }

  /**
   * Removes all chunks of a document.
   *
   * @return number of chunks removed
   */
  public long deleteDocument(String projectId, String documentId) {
    long removed = chunkStore.deleteByDocument(projectId, documentId);
    log.info("Removed {} chunks of document {} in project {}", removed, documentId, projectId);
    return removed;
  }

  private void removePartialWrite(String projectId, String documentId, RuntimeException cause) {
    try {
      chunkStore.deleteByDocument(projectId, documentId);
    } catch (RuntimeException cleanupFailure) {
      cause.addSuppressed(cleanupFailure);
      log.error(
          "Could not remove partially stored chunks of document {}: {}",
          documentId,
          cleanupFailure.getMessage());
    }
  }

  /** Text embedded for a chunk: its heading path followed by its content. */
  static String embeddingText(DocumentChunk chunk) {
    if (chunk.getHeadingPath().isEmpty()) {
      return chunk.getContent();
    }
    return chunk.headingPathText() + "\n\n" + chunk.getContent();
  }
}
