package com.flamingo.ai.docindex.service.rag.embedding;

import com.flamingo.ai.docindex.exception.EmbeddingDimensionException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Guarded calls to the LangChain4j embedding model.
 *
 * <p>Every call is rate limited, circuit broken and retried. When retries are exhausted, the
 * circuit is open, or the model answers with vectors of the wrong dimension, the fallback returns
 * hashed vectors from {@link HashingEmbeddingGenerator} instead, so callers never see the failure.
 */
@Component
@ConditionalOnProperty(prefix = "rag.embedding", name = "provider", havingValue = "openai")
@Slf4j
public class EmbeddingModelClient {

  // text-embedding-3-small accepts 8192 tokens; dense CJK text can approach 1 char per token
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private static final String QUERY_PREFIX =
      "Represent this question for retrieving relevant document passages: ";
  private static final String PASSAGE_PREFIX = "Represent this document passage for retrieval: ";

  private final EmbeddingModel embeddingModel;
  private final HashingEmbeddingGenerator fallbackGenerator;
  private final MeterRegistry meterRegistry;
  private final int dimensions;

  public EmbeddingModelClient(
      EmbeddingModel embeddingModel,
      HashingEmbeddingGenerator fallbackGenerator,
      MeterRegistry meterRegistry,
      @Value("${rag.embedding.dimensions:384}") int dimensions) {
    this.embeddingModel = embeddingModel;
    this.fallbackGenerator = fallbackGenerator;
    this.meterRegistry = meterRegistry;
    this.dimensions = dimensions;
  }

  /**
   * Embeds one batch of passages with the passage instruction prefix.
   *
   * @param texts the passages
   * @return vectors in input order
   * @throws EmbeddingDimensionException if the model returns vectors of the wrong length; only
   *     visible when called without the resilience proxy
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed one batch")
  @Retry(name = "embedding", fallbackMethod = "embedBatchFallback")
  @CircuitBreaker(name = "embedding")
  @RateLimiter(name = "embedding")
  public EmbeddingBatch embedBatch(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(prepare(PASSAGE_PREFIX, text)));
    }

    log.debug("Calling embedding model for batch of {} passages", texts.size());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != texts.size()) {
      throw new IllegalStateException(
          String.format(
              "Embedding model returned %d vectors for %d passages",
              embeddings.size(), texts.size()));
    }

    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(checkDimension(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return new EmbeddingBatch(vectors, 0);
  }

  /**
   * Embeds a query with the query instruction prefix.
   *
   * @param query the query text
   * @return the query vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @Retry(name = "embedding", fallbackMethod = "embedQueryFallback")
  @CircuitBreaker(name = "embedding")
  @RateLimiter(name = "embedding")
  public float[] embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(prepare(QUERY_PREFIX, query));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return checkDimension(response.content().vector());
  }

  private float[] checkDimension(float[] vector) {
    if (vector.length != dimensions) {
      throw new EmbeddingDimensionException(dimensions, vector.length);
    }
    return vector;
  }

  private String prepare(String prefix, String text) {
    String prefixed = prefix + (text == null ? "" : text);
    if (prefixed.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          prefixed.length(),
          MAX_CHARS_PER_EMBEDDING);
      return prefixed.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return prefixed;
  }

  @SuppressWarnings("unused")
  private EmbeddingBatch embedBatchFallback(List<String> texts, Throwable t) {
    log.warn(
        "Embedding batch of {} passages failed, using hashed fallback vectors: {}",
        texts.size(),
        t.getMessage());
    meterRegistry
        .counter("embedding.fallback", "reason", t.getClass().getSimpleName())
        .increment(texts.size());
    return new EmbeddingBatch(fallbackGenerator.generateAll(texts), texts.size());
  }

  @SuppressWarnings("unused")
  private float[] embedQueryFallback(String query, Throwable t) {
    log.warn("Query embedding failed, using hashed fallback vector: {}", t.getMessage());
    meterRegistry.counter("embedding.fallback", "reason", t.getClass().getSimpleName()).increment();
    return fallbackGenerator.generate(query);
  }
}
