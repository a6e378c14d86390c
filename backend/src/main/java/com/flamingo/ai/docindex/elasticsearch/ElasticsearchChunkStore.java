package com.flamingo.ai.docindex.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOptions;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.docindex.config.RagConfig;
import com.flamingo.ai.docindex.exception.SearchException;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import com.flamingo.ai.docindex.service.rag.semantic.VectorMath;
import com.flamingo.ai.docindex.store.ChunkFilter;
import com.flamingo.ai.docindex.store.ChunkVectorStore;
import com.flamingo.ai.docindex.store.ScoredChunk;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Chunk store backed by one Elasticsearch index with a cosine {@code dense_vector} field.
 *
 * <p>Documents are keyed {@code projectId:chunkId}. Filters become {@code bool} filter clauses;
 * similarity search is a kNN query with the same clauses as pre-filter. Elasticsearch reports
 * cosine kNN scores as {@code (1 + cos) / 2}, which is converted back to a cosine similarity.
 */
@Component
@ConditionalOnProperty(prefix = "rag.store", name = "type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchChunkStore implements ChunkVectorStore {

  private static final int NUM_CANDIDATES_FACTOR = 4;

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final ChunkDocumentMapper mapper;

  @Value("${app.elasticsearch.index-name:doc-index-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  private final int vectorDimensions;

  @Autowired
  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      ChunkDocumentMapper mapper,
      RagConfig ragConfig) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.mapper = mapper;
    this.vectorDimensions = ragConfig.getEmbedding().getDimensions();
  }

  /** Constructor for testing; skips property injection. */
  @VisibleForTesting
  ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      ChunkDocumentMapper mapper,
      String indexName,
      int vectorDimensions) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.mapper = mapper;
    this.indexName = indexName;
    this.textAnalyzer = "standard";
    this.vectorDimensions = vectorDimensions;
  }

  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (exists) {
        log.debug("Index '{}' already exists", indexName);
        return;
      }
      CreateIndexRequest request =
          CreateIndexRequest.of(
              c ->
                  c.index(indexName)
                      .mappings(
                          m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
      elasticsearchClient.indices().create(request);
      log.info("Created Elasticsearch index: {}", indexName);
    } catch (IOException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> indexProperties() {
    Map<String, Property> properties = new HashMap<>();
    for (String keyword :
        List.of(
            ChunkDocumentMapper.PROJECT_ID,
            ChunkDocumentMapper.CHUNK_ID,
            ChunkDocumentMapper.DOCUMENT_ID,
            ChunkDocumentMapper.HEADING_PATH,
            ChunkDocumentMapper.HEADING_PATH_TEXT,
            ChunkDocumentMapper.CHUNK_TYPE,
            ChunkDocumentMapper.TOPIC_KEYWORDS,
            ChunkDocumentMapper.PREVIOUS_CHUNK_ID,
            ChunkDocumentMapper.NEXT_CHUNK_ID,
            ChunkDocumentMapper.SIBLING_CHUNK_IDS,
            ChunkDocumentMapper.CHILD_CHUNK_IDS,
            ChunkDocumentMapper.SOURCE_FILE_ID,
            ChunkDocumentMapper.SOURCE_FILE_NAME,
            ChunkDocumentMapper.CHUNKING_METHOD)) {
      properties.put(keyword, Property.of(p -> p.keyword(k -> k)));
    }
    for (String integer :
        List.of(
            ChunkDocumentMapper.TOKENS,
            ChunkDocumentMapper.POSITION,
            ChunkDocumentMapper.HIERARCHY_LEVEL)) {
      properties.put(integer, Property.of(p -> p.integer(i -> i)));
    }
    properties.put(
        ChunkDocumentMapper.CONTENT,
        Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(ChunkDocumentMapper.OVERLAP_TEXT, Property.of(p -> p.text(t -> t.index(false))));
    properties.put(ChunkDocumentMapper.SEMANTIC_DENSITY, Property.of(p -> p.float_(f -> f)));
    properties.put(ChunkDocumentMapper.OVERLAP_PREVIOUS, Property.of(p -> p.boolean_(b -> b)));
    properties.put(ChunkDocumentMapper.OVERLAP_NEXT, Property.of(p -> p.boolean_(b -> b)));
    properties.put(ChunkDocumentMapper.CREATED_AT, Property.of(p -> p.date(d -> d)));
    properties.put(
        ChunkDocumentMapper.EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "elasticsearch.upsert", description = "Time to index chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void upsert(String projectId, List<DocumentChunk> chunks, List<float[]> vectors) {
    if (chunks.size() != vectors.size()) {
      throw new IllegalArgumentException(
          "Got " + vectors.size() + " vectors for " + chunks.size() + " chunks");
    }
    if (chunks.isEmpty()) {
      return;
    }
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (int i = 0; i < chunks.size(); i++) {
      DocumentChunk chunk = chunks.get(i);
      Map<String, Object> document = mapper.toDocument(projectId, chunk, vectors.get(i));
      String id = documentKey(projectId, chunk.getId());
      bulk.operations(op -> op.index(idx -> idx.index(indexName).id(id).document(document)));
    }
    try {
      BulkResponse response = elasticsearchClient.bulk(bulk.refresh(Refresh.WaitFor).build());
      if (response.errors()) {
        List<String> reasons = new ArrayList<>();
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            reasons.add(item.id() + ": " + item.error().reason());
          }
        }
        meterRegistry.counter("chunk_store.index.errors").increment();
        throw new SearchException(
            String.format(
                "Bulk indexing into %s failed for %d chunks: %s",
                indexName, reasons.size(), reasons));
      }
      meterRegistry.counter("chunk_store.indexed").increment(chunks.size());
      log.debug("Indexed {} chunks into {}", chunks.size(), indexName);
    } catch (IOException e) {
      log.error("Failed to index chunks into {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Failed to index chunks", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "queryFallback")
  public List<ScoredChunk> query(float[] vector, int topK, ChunkFilter filter) {
    List<Query> filters = filterClauses(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field(ChunkDocumentMapper.EMBEDDING)
                                .queryVector(ChunkDocumentMapper.toFloatList(vector))
                                .k(topK)
                                .numCandidates(Math.max(topK, 1) * NUM_CANDIDATES_FACTOR)
                                .filter(filters))
                    .size(topK));
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<ScoredChunk> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        DocumentChunk chunk = decode(hit.id(), hit.source());
        double score = hit.score() == null ? 0.0 : hit.score();
        results.add(new ScoredChunk(chunk, toCosine(score)));
      }
      meterRegistry.counter("chunk_store.vector_search").increment();
      log.debug("Vector search in {} returned {} hits", indexName, results.size());
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Vector search failed", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.filter_search", description = "Time for filtered chunk lookup")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "getByFilterFallback")
  public List<DocumentChunk> getByFilter(ChunkFilter filter, int limit) {
    List<Query> filters = filterClauses(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.bool(b -> b.filter(filters)))
                    .sort(ascending(ChunkDocumentMapper.DOCUMENT_ID))
                    .sort(ascending(ChunkDocumentMapper.POSITION))
                    .size(limit));
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<DocumentChunk> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        results.add(decode(hit.id(), hit.source()));
      }
      return results;
    } catch (IOException e) {
      log.error("Filtered search failed for {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Filtered search failed", e);
    }
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "getByIdFallback")
  public Optional<DocumentChunk> getById(String projectId, String chunkId) {
    try {
      GetResponse<Map> response =
          elasticsearchClient.get(
              g -> g.index(indexName).id(documentKey(projectId, chunkId)), Map.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      return Optional.of(decode(response.id(), response.source()));
    } catch (IOException e) {
      log.error("Chunk lookup failed for {}: {}", chunkId, e.getMessage(), e);
      throw new SearchException("Chunk lookup failed", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete chunks of a document")
  @CircuitBreaker(name = "elasticsearch")
  public long deleteByDocument(String projectId, String documentId) {
    try {
      DeleteByQueryResponse response =
          elasticsearchClient.deleteByQuery(
              d ->
                  d.index(indexName)
                      .refresh(true)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      b.filter(term(ChunkDocumentMapper.PROJECT_ID, projectId))
                                          .filter(
                                              term(
                                                  ChunkDocumentMapper.DOCUMENT_ID,
                                                  documentId)))));
      long deleted = response.deleted() == null ? 0 : response.deleted();
      log.info("Deleted {} chunks of document {} from {}", deleted, documentId, indexName);
      meterRegistry.counter("chunk_store.deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      log.error(
          "Failed to delete chunks of document {} from {}: {}",
          documentId,
          indexName,
          e.getMessage(),
          e);
      throw new SearchException("Failed to delete chunks", e);
    }
  }

  @VisibleForTesting
  List<Query> filterClauses(ChunkFilter filter) {
    if (filter.getProjectId() == null) {
      throw new IllegalArgumentException("projectId filter is required");
    }
    List<Query> clauses = new ArrayList<>();
    clauses.add(term(ChunkDocumentMapper.PROJECT_ID, filter.getProjectId()));
    if (filter.getDocumentId() != null) {
      clauses.add(term(ChunkDocumentMapper.DOCUMENT_ID, filter.getDocumentId()));
    }
    if (filter.getChunkType() != null) {
      clauses.add(term(ChunkDocumentMapper.CHUNK_TYPE, filter.getChunkType().name()));
    }
    if (filter.getHierarchyLevel() != null) {
      int level = filter.getHierarchyLevel();
      clauses.add(
          Query.of(q -> q.term(t -> t.field(ChunkDocumentMapper.HIERARCHY_LEVEL).value(level))));
    }
    if (filter.getHeadingPathContains() != null) {
      String pattern = "*" + escapeWildcard(filter.getHeadingPathContains()) + "*";
      clauses.add(
          Query.of(
              q ->
                  q.wildcard(
                      w ->
                          w.field(ChunkDocumentMapper.HEADING_PATH_TEXT)
                              .value(pattern)
                              .caseInsensitive(true))));
    }
    if (filter.getMinPosition() != null || filter.getMaxPosition() != null) {
      Integer min = filter.getMinPosition();
      Integer max = filter.getMaxPosition();
      clauses.add(
          Query.of(
              q ->
                  q.range(
                      r ->
                          r.number(
                              n -> {
                                n.field(ChunkDocumentMapper.POSITION);
                                if (min != null) {
                                  n.gte(min.doubleValue());
                                }
                                if (max != null) {
                                  n.lte(max.doubleValue());
                                }
                                return n;
                              }))));
    }
    if (!filter.getAnyTerms().isEmpty()) {
      List<Query> should = new ArrayList<>();
      for (String termValue : filter.getAnyTerms()) {
        should.add(
            Query.of(q -> q.match(m -> m.field(ChunkDocumentMapper.CONTENT).query(termValue))));
        should.add(term(ChunkDocumentMapper.TOPIC_KEYWORDS, termValue));
      }
      clauses.add(Query.of(q -> q.bool(b -> b.should(should).minimumShouldMatch("1"))));
    }
    if (filter.getAfterDocumentId() != null) {
      clauses.add(afterCursor(filter.getAfterDocumentId(), filter.getAfterPosition()));
    }
    return clauses;
  }

  /** Chunks sorting after (documentId, position) in the documentId, position sort order. */
  private static Query afterCursor(String documentId, Integer position) {
    Query laterDocument =
        Query.of(
            q ->
                q.range(
                    r -> r.term(t -> t.field(ChunkDocumentMapper.DOCUMENT_ID).gt(documentId))));
    if (position == null) {
      return laterDocument;
    }
    Query laterPosition =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(term(ChunkDocumentMapper.DOCUMENT_ID, documentId))
                            .filter(
                                Query.of(
                                    p ->
                                        p.range(
                                            r ->
                                                r.number(
                                                    n ->
                                                        n.field(ChunkDocumentMapper.POSITION)
                                                            .gt(position.doubleValue())))))));
    return Query.of(
        q -> q.bool(b -> b.should(laterDocument, laterPosition).minimumShouldMatch("1")));
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private DocumentChunk decode(String id, Map source) {
    return mapper.fromDocument(id, (Map<String, Object>) source);
  }

  @SuppressWarnings("unused")
  private List<ScoredChunk> queryFallback(
      float[] vector, int topK, ChunkFilter filter, Throwable t) {
    throw fallbackFailure("vector search", t);
  }

  @SuppressWarnings("unused")
  private List<DocumentChunk> getByFilterFallback(ChunkFilter filter, int limit, Throwable t) {
    throw fallbackFailure("filtered search", t);
  }

  @SuppressWarnings("unused")
  private Optional<DocumentChunk> getByIdFallback(String projectId, String chunkId, Throwable t) {
    throw fallbackFailure("chunk lookup", t);
  }

  private SearchException fallbackFailure(String operation, Throwable t) {
    log.warn("{} {} fallback triggered: {}", indexName, operation, t.getMessage());
    meterRegistry.counter("chunk_store.fallback", "operation", operation).increment();
    if (t instanceof SearchException searchException) {
      return searchException;
    }
    return new SearchException(operation + " unavailable", t);
  }

  /** Converts an Elasticsearch cosine kNN score back to cosine similarity, clamped to [0,1]. */
  @VisibleForTesting
  static double toCosine(double score) {
    return VectorMath.clamp(2.0 * score - 1.0);
  }

  private static SortOptions ascending(String field) {
    return SortOptions.of(so -> so.field(f -> f.field(field).order(SortOrder.Asc)));
  }

  private static Query term(String field, String value) {
    return Query.of(q -> q.term(t -> t.field(field).value(value)));
  }

  private static String escapeWildcard(String value) {
    return value.replace("\\", "\\\\").replace("*", "\\*").replace("?", "\\?");
  }

  private static String documentKey(String projectId, String chunkId) {
    return projectId + ":" + chunkId;
  }
}
