package com.flamingo.ai.docindex.store;

import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.List;
import java.util.Optional;

/**
 * Persistence and similarity search for embedded chunks, scoped by project.
 *
 * <p>Implementations signal unreachable backends with {@link
 * com.flamingo.ai.docindex.exception.SearchException} and undecodable records with {@link
 * com.flamingo.ai.docindex.exception.MalformedChunkDataException}.
 */
public interface ChunkVectorStore {

  /**
   * Stores chunks with their vectors, replacing records with the same id.
   *
   * @param projectId owning project
   * @param chunks chunks to store
   * @param vectors one vector per chunk, same order
   */
  void upsert(String projectId, List<DocumentChunk> chunks, List<float[]> vectors);

  /**
   * Nearest chunks to a vector among those matching the filter, most similar first.
   *
   * @param vector query vector
   * @param topK maximum number of hits
   * @param filter restrictions, must name a project
   * @return hits with cosine similarity in [0,1]
   */
  List<ScoredChunk> query(float[] vector, int topK, ChunkFilter filter);

  /** Chunks matching the filter ordered by document id, then position. */
  List<DocumentChunk> getByFilter(ChunkFilter filter, int limit);

  Optional<DocumentChunk> getById(String projectId, String chunkId);

  /**
   * Removes every chunk of one document.
   *
   * @return number of chunks removed, where the backend reports it
   */
  long deleteByDocument(String projectId, String documentId);
}
