package com.flamingo.ai.docindex.service.retrieval;

import com.flamingo.ai.docindex.domain.enums.ChunkRelation;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** A chunk returned by retrieval, with the scores and context of this particular request. */
@Value
@Builder(toBuilder = true)
public class RetrievedChunk {

  DocumentChunk chunk;

  /** Cosine similarity to the query; {@code null} for strategies that do not compare vectors. */
  Double similarity;

  /** Ranking score of the strategy that produced the hit. */
  double score;

  /** Neighbouring chunks of the same document in position order. */
  @Builder.Default List<DocumentChunk> context = List.of();

  /** How the chunk relates to the source chunk of a related-chunks request. */
  ChunkRelation relation;

  public String getId() {
    return chunk.getId();
  }
}
