package com.flamingo.ai.docindex.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkRelationshipLinker Tests")
class ChunkRelationshipLinkerTest {

  private final ChunkRelationshipLinker linker = new ChunkRelationshipLinker();

  private DocumentChunk chunk(String id, int position, String... path) {
    return DocumentChunk.builder()
        .id(id)
        .documentId("doc-1")
        .content("content " + id)
        .tokens(2)
        .position(position)
        .headingPath(List.of(path))
        .hierarchyLevel(path.length)
        .chunkType(ChunkType.PARAGRAPH)
        .build();
  }

  private List<DocumentChunk> sample() {
    return linker.link(
        List.of(
            chunk("c0", 0, "A"),
            chunk("c1", 1, "A", "B"),
            chunk("c2", 2, "A", "C"),
            chunk("c3", 3, "D")));
  }

  @Test
  @DisplayName("should link neighbours in reading order")
  void shouldLinkReadingOrder() {
    List<DocumentChunk> linked = sample();

    assertThat(linked.get(0).getPreviousChunkId()).isNull();
    assertThat(linked.get(0).getNextChunkId()).isEqualTo("c1");
    assertThat(linked.get(2).getPreviousChunkId()).isEqualTo("c1");
    assertThat(linked.get(3).getNextChunkId()).isNull();
  }

  @Test
  @DisplayName("should link siblings sharing level and parent path")
  void shouldLinkSiblings() {
    List<DocumentChunk> linked = sample();

    assertThat(linked.get(0).getSiblingChunkIds()).containsExactly("c3");
    assertThat(linked.get(1).getSiblingChunkIds()).containsExactly("c2");
    assertThat(linked.get(2).getSiblingChunkIds()).containsExactly("c1");
  }

  @Test
  @DisplayName("should link children one level deeper under the same path")
  void shouldLinkChildren() {
    List<DocumentChunk> linked = sample();

    assertThat(linked.get(0).getChildChunkIds()).containsExactly("c1", "c2");
    assertThat(linked.get(1).getChildChunkIds()).isEmpty();
    assertThat(linked.get(3).getChildChunkIds()).isEmpty();
  }

  @Test
  @DisplayName("should treat chunks outside any section as siblings of each other")
  void shouldLinkRootLevelChunks() {
    List<DocumentChunk> linked = linker.link(List.of(chunk("p0", 0), chunk("p1", 1)));

    assertThat(linked.get(0).getSiblingChunkIds()).containsExactly("p1");
    assertThat(linked.get(1).getSiblingChunkIds()).containsExactly("p0");
  }

  @Test
  @DisplayName("should return an empty list for no chunks")
  void shouldHandleEmptyInput() {
    assertThat(linker.link(List.of())).isEmpty();
  }
}
