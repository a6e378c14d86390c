package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import java.util.List;

/**
 * Chunk under construction. Each assembly step returns new drafts rather than editing old ones.
 *
 * @param content chunk text
 * @param tokens token count of {@code content}
 * @param type content type
 * @param headingPath headings enclosing all of the content
 * @param firstPosition position of the first covered node
 * @param lastPosition position of the last covered node
 * @param nodeIds covered node ids in order, repeated for pieces of a split node
 * @param density internal embedding coherence
 * @param sectionId top-level section the content belongs to, {@code null} outside any section
 */
record DraftChunk(
    String content,
    int tokens,
    ChunkType type,
    List<String> headingPath,
    int firstPosition,
    int lastPosition,
    List<String> nodeIds,
    double density,
    String sectionId) {

  int level() {
    return headingPath.size();
  }
}
