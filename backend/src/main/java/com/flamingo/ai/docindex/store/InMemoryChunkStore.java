package com.flamingo.ai.docindex.store;

import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.service.rag.semantic.VectorMath;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Chunk store kept in process memory, searched by a full cosine scan.
 *
 * <p>Used for local runs and tests. Safe for concurrent use; a document's chunks become visible
 * one by one during an upsert.
 */
@Component
@ConditionalOnProperty(name = "rag.store.type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryChunkStore implements ChunkVectorStore {

  private static final Comparator<DocumentChunk> DOCUMENT_ORDER =
      Comparator.comparing(DocumentChunk::getDocumentId)
          .thenComparingInt(DocumentChunk::getPosition);

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();

  @Override
  public void upsert(String projectId, List<DocumentChunk> chunks, List<float[]> vectors) {
    if (chunks.size() != vectors.size()) {
      throw new IllegalArgumentException(
          "Got " + vectors.size() + " vectors for " + chunks.size() + " chunks");
    }
    for (int i = 0; i < chunks.size(); i++) {
      DocumentChunk chunk = chunks.get(i);
      entries.put(key(projectId, chunk.getId()), new Entry(projectId, chunk, vectors.get(i)));
    }
    log.debug("Stored {} chunks for project {}", chunks.size(), projectId);
  }

  @Override
  public List<ScoredChunk> query(float[] vector, int topK, ChunkFilter filter) {
    return entries.values().stream()
        .filter(entry -> filter.matches(entry.projectId(), entry.chunk()))
        .map(entry -> new ScoredChunk(entry.chunk(), VectorMath.cosine(vector, entry.vector())))
        .sorted(
            Comparator.comparingDouble(ScoredChunk::similarity)
                .reversed()
                .thenComparing(ScoredChunk::chunk, DOCUMENT_ORDER))
        .limit(topK)
        .toList();
  }

  @Override
  public List<DocumentChunk> getByFilter(ChunkFilter filter, int limit) {
    return entries.values().stream()
        .filter(entry -> filter.matches(entry.projectId(), entry.chunk()))
        .map(Entry::chunk)
        .sorted(DOCUMENT_ORDER)
        .limit(limit)
        .toList();
  }

  @Override
  public Optional<DocumentChunk> getById(String projectId, String chunkId) {
    return Optional.ofNullable(entries.get(key(projectId, chunkId))).map(Entry::chunk);
  }

  @Override
  public long deleteByDocument(String projectId, String documentId) {
    long before = entries.size();
    entries
        .values()
        .removeIf(
            entry ->
                entry.projectId().equals(projectId)
                    && entry.chunk().getDocumentId().equals(documentId));
    long removed = before - entries.size();
    log.debug("Removed {} chunks of document {} in project {}", removed, documentId, projectId);
    return removed;
  }

  private static String key(String projectId, String chunkId) {
    return projectId + ":" + chunkId;
  }

  private record Entry(String projectId, DocumentChunk chunk, float[] vector) {}
}
