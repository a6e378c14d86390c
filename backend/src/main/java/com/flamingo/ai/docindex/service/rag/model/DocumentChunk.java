package com.flamingo.ai.docindex.service.rag.model;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The unit of retrieval.
 *
 * <p>Token count lies within the configured bounds except for at most one unavoidable fragment.
 * Chunks are immutable after overlap and relationship assignment; retrieval scores and context are
 * carried by wrappers and never written back.
 */
@Value
@Builder(toBuilder = true)
public class DocumentChunk {

  String id;
  String documentId;
  String content;
  int tokens;

  /** Index of the chunk within its document. */
  int position;

  @Builder.Default List<String> headingPath = List.of();

  /** Number of headings enclosing the chunk; equals the heading path length. */
  int hierarchyLevel;

  ChunkType chunkType;

  /** Internal embedding coherence, in [0,1]. */
  double semanticDensity;

  @Builder.Default List<String> topicKeywords = List.of();

  boolean overlapPrevious;
  boolean overlapNext;

  /** Trailing text of this chunk repeated as context for the next one. */
  String overlapText;

  String previousChunkId;
  String nextChunkId;
  @Builder.Default List<String> siblingChunkIds = List.of();
  @Builder.Default List<String> childChunkIds = List.of();

  ChunkProvenance metadata;

  /** Heading path joined for display and substring filtering. */
  public String headingPathText() {
    return String.join(" > ", headingPath);
  }
}
