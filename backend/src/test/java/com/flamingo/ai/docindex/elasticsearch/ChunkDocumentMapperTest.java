package com.flamingo.ai.docindex.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.domain.enums.ChunkingMethod;
import com.flamingo.ai.docindex.exception.MalformedChunkDataException;
import com.flamingo.ai.docindex.service.rag.model.ChunkProvenance;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkDocumentMapper Tests")
class ChunkDocumentMapperTest {

  private final ChunkDocumentMapper mapper = new ChunkDocumentMapper();

  private DocumentChunk sampleChunk() {
    return DocumentChunk.builder()
        .id("doc-1_chunk_3")
        .documentId("doc-1")
        .content("Consent forms are stored for FERPA audits.")
        .tokens(9)
        .position(3)
        .headingPath(List.of("2 Methods", "2.1 Setup"))
        .hierarchyLevel(2)
        .chunkType(ChunkType.PARAGRAPH)
        .semanticDensity(0.75)
        .topicKeywords(List.of("consent", "ferpa"))
        .overlapNext(true)
        .overlapText("FERPA audits.")
        .previousChunkId("doc-1_chunk_2")
        .siblingChunkIds(List.of("doc-1_chunk_5"))
        .metadata(
            ChunkProvenance.builder()
                .sourceFileId("file-9")
                .sourceFileName("policy.md")
                .chunkingMethod(ChunkingMethod.HYBRID)
                .createdAt(Instant.parse("2024-05-01T10:15:30Z"))
                .build())
        .build();
  }

  private Map<String, Object> minimalSource() {
    Map<String, Object> source = new HashMap<>();
    source.put("chunkId", "doc-1_chunk_0");
    source.put("documentId", "doc-1");
    source.put("content", "Introduction");
    source.put("position", 0);
    source.put("chunkType", "HEADING");
    source.put("headingPath", List.of("Introduction"));
    return source;
  }

  @Nested
  @DisplayName("Encoding")
  class Encoding {

    @Test
    @DisplayName("should flatten chunk fields and the vector into one record")
    void shouldFlattenChunk() {
      Map<String, Object> document =
          mapper.toDocument("p1", sampleChunk(), new float[] {0.5f, 0.25f});

      assertThat(document)
          .containsEntry("projectId", "p1")
          .containsEntry("chunkType", "PARAGRAPH")
          .containsEntry("headingPathText", "2 Methods > 2.1 Setup")
          .containsEntry("chunkingMethod", "HYBRID")
          .containsEntry("createdAt", "2024-05-01T10:15:30Z")
          .containsEntry("embedding", List.of(0.5f, 0.25f))
          .doesNotContainKey("nextChunkId");
    }

    @Test
    @DisplayName("should restore the same chunk from its record")
    void shouldRestoreChunk() {
      DocumentChunk chunk = sampleChunk();

      DocumentChunk restored =
          mapper.fromDocument("p1:doc-1_chunk_3", mapper.toDocument("p1", chunk, new float[] {1f}));

      assertThat(restored).isEqualTo(chunk);
    }
  }

  @Nested
  @DisplayName("Decoding")
  class Decoding {

    @Test
    @DisplayName("should default optional fields")
    void shouldDefaultOptionalFields() {
      DocumentChunk chunk = mapper.fromDocument("r1", minimalSource());

      assertThat(chunk.getTokens()).isZero();
      assertThat(chunk.getHierarchyLevel()).isEqualTo(1);
      assertThat(chunk.getTopicKeywords()).isEmpty();
      assertThat(chunk.getChildChunkIds()).isEmpty();
      assertThat(chunk.isOverlapNext()).isFalse();
      assertThat(chunk.getMetadata().getCreatedAt()).isNull();
    }

    @Test
    @DisplayName("should reject a record without a required field")
    void shouldRejectMissingField() {
      Map<String, Object> source = minimalSource();
      source.remove("content");

      assertThatThrownBy(() -> mapper.fromDocument("r1", source))
          .isInstanceOf(MalformedChunkDataException.class)
          .hasMessageContaining("r1")
          .hasMessageContaining("content");
    }

    @Test
    @DisplayName("should reject fields of the wrong type")
    void shouldRejectWrongType() {
      Map<String, Object> source = minimalSource();
      source.put("position", "third");

      assertThatThrownBy(() -> mapper.fromDocument("r1", source))
          .isInstanceOf(MalformedChunkDataException.class);
    }

    @Test
    @DisplayName("should reject an unknown chunk type")
    void shouldRejectUnknownType() {
      Map<String, Object> source = minimalSource();
      source.put("chunkType", "FOOTNOTE");

      assertThatThrownBy(() -> mapper.fromDocument("r1", source))
          .isInstanceOf(MalformedChunkDataException.class)
          .extracting(e -> ((MalformedChunkDataException) e).getRecordId())
          .isEqualTo("r1");
    }

    @Test
    @DisplayName("should reject a record without source")
    void shouldRejectMissingSource() {
      assertThatThrownBy(() -> mapper.fromDocument("r1", null))
          .isInstanceOf(MalformedChunkDataException.class);
    }
  }
}
