package com.flamingo.ai.docindex.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.bulk.OperationType;
import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.exception.SearchException;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.store.ChunkFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchChunkStore Tests")
class ElasticsearchChunkStoreTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private ElasticsearchChunkStore store;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    store =
        new ElasticsearchChunkStore(
            elasticsearchClient, meterRegistry, new ChunkDocumentMapper(), "test-chunks", 3);
  }

  private static DocumentChunk chunk(String id) {
    return DocumentChunk.builder()
        .id(id)
        .documentId("doc-1")
        .content("text " + id)
        .tokens(2)
        .chunkType(ChunkType.PARAGRAPH)
        .build();
  }

  @Nested
  @DisplayName("Filter translation")
  class FilterTranslation {

    @Test
    @DisplayName("should always restrict by project")
    void shouldRestrictByProject() {
      List<Query> clauses = store.filterClauses(ChunkFilter.forProject("p1"));

      assertThat(clauses).hasSize(1);
      assertThat(clauses.get(0).isTerm()).isTrue();
      assertThat(clauses.get(0).term().field()).isEqualTo("projectId");
      assertThat(clauses.get(0).term().value().stringValue()).isEqualTo("p1");
    }

    @Test
    @DisplayName("should translate every filter field into its own clause")
    void shouldTranslateAllFields() {
      ChunkFilter filter =
          ChunkFilter.forProject("p1").toBuilder()
              .documentId("doc-1")
              .chunkType(ChunkType.HEADING)
              .hierarchyLevel(2)
              .headingPathContains("a*b")
              .minPosition(3)
              .maxPosition(7)
              .anyTerms(List.of("ferpa"))
              .build();

      List<Query> clauses = store.filterClauses(filter);

      assertThat(clauses).hasSize(7);
      assertThat(clauses.get(2).term().value().stringValue()).isEqualTo("HEADING");
      assertThat(clauses.get(3).term().value().longValue()).isEqualTo(2L);
      assertThat(clauses.get(4).wildcard().value()).isEqualTo("*a\\*b*");
      assertThat(clauses.get(4).wildcard().caseInsensitive()).isTrue();
      assertThat(clauses.get(5).isRange()).isTrue();
      assertThat(clauses.get(6).bool().should()).hasSize(2);
      assertThat(clauses.get(6).bool().minimumShouldMatch()).isEqualTo("1");
    }

    @Test
    @DisplayName("should translate a cursor into a later-document or later-position clause")
    void shouldTranslateCursor() {
      ChunkFilter filter =
          ChunkFilter.forProject("p1").toBuilder()
              .afterDocumentId("doc-1")
              .afterPosition(4)
              .build();

      List<Query> clauses = store.filterClauses(filter);

      assertThat(clauses).hasSize(2);
      List<Query> should = clauses.get(1).bool().should();
      assertThat(should).hasSize(2);
      assertThat(should.get(0).isRange()).isTrue();
      assertThat(should.get(1).bool().filter()).hasSize(2);
      assertThat(clauses.get(1).bool().minimumShouldMatch()).isEqualTo("1");
    }

    @Test
    @DisplayName("should refuse filters without a project")
    void shouldRequireProject() {
      assertThatThrownBy(() -> store.filterClauses(ChunkFilter.builder().build()))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Index mapping")
  class IndexMapping {

    @Test
    @DisplayName("should map the embedding as a cosine dense vector of the configured size")
    void shouldMapEmbedding() {
      Map<String, Property> properties = store.indexProperties();

      assertThat(properties.get("embedding").isDenseVector()).isTrue();
      assertThat(properties.get("embedding").denseVector().dims()).isEqualTo(3);
      assertThat(properties.get("content").isText()).isTrue();
      assertThat(properties.get("projectId").isKeyword()).isTrue();
      assertThat(properties.get("headingPathText").isKeyword()).isTrue();
      assertThat(properties.get("position").isInteger()).isTrue();
    }
  }

  @Nested
  @DisplayName("Writes")
  class Writes {

    @Test
    @DisplayName("should bulk index chunks keyed by project and chunk id")
    void shouldBulkIndex() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(BulkResponse.of(b -> b.errors(false).took(3).items(List.of())));

      store.upsert(
          "p1", List.of(chunk("c0"), chunk("c1")), List.of(new float[3], new float[3]));

      ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);
      verify(elasticsearchClient).bulk(captor.capture());
      assertThat(captor.getValue().operations()).hasSize(2);
      assertThat(captor.getValue().operations().get(1).index().id()).isEqualTo("p1:c1");
      assertThat(captor.getValue().refresh()).isEqualTo(Refresh.WaitFor);
      assertThat(meterRegistry.counter("chunk_store.indexed").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should fail when any bulk item is rejected")
    void shouldFailOnBulkErrors() throws IOException {
      BulkResponseItem rejected =
          BulkResponseItem.of(
              i ->
                  i.operationType(OperationType.Index)
                      .index("test-chunks")
                      .id("p1:c0")
                      .status(400)
                      .error(e -> e.type("mapper_parsing_exception").reason("bad vector")));
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(BulkResponse.of(b -> b.errors(true).took(3).items(List.of(rejected))));

      assertThatThrownBy(() -> store.upsert("p1", List.of(chunk("c0")), List.of(new float[3])))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("bad vector");
      assertThat(meterRegistry.counter("chunk_store.index.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip the round trip for an empty upsert")
    void shouldSkipEmptyUpsert() {
      store.upsert("p1", List.of(), List.of());

      verifyNoInteractions(elasticsearchClient);
    }

    @Test
    @DisplayName("should reject mismatched chunk and vector counts")
    void shouldRejectMismatchedVectors() {
      assertThatThrownBy(() -> store.upsert("p1", List.of(chunk("c0")), List.of()))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(elasticsearchClient);
    }
  }

  @Nested
  @DisplayName("Reads")
  class Reads {

    @Test
    @DisplayName("should wrap transport failures of vector search")
    void shouldWrapVectorSearchFailure() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(
              () -> store.query(new float[] {1f, 0f, 0f}, 5, ChunkFilter.forProject("p1")))
          .isInstanceOf(SearchException.class)
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("should wrap transport failures of filtered search")
    void shouldWrapFilterSearchFailure() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> store.getByFilter(ChunkFilter.forProject("p1"), 10))
          .isInstanceOf(SearchException.class);
    }

    @Test
    @DisplayName("should convert kNN scores back to cosine similarity")
    void shouldConvertScores() {
      assertThat(ElasticsearchChunkStore.toCosine(1.0)).isEqualTo(1.0);
      assertThat(ElasticsearchChunkStore.toCosine(0.75)).isCloseTo(0.5, within(1e-9));
      assertThat(ElasticsearchChunkStore.toCosine(0.5)).isZero();
      assertThat(ElasticsearchChunkStore.toCosine(0.2)).isZero();
    }
  }
}
