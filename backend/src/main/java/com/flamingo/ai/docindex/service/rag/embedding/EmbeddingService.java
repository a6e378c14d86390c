package com.flamingo.ai.docindex.service.rag.embedding;

import com.flamingo.ai.docindex.config.RagConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link TextEmbedder} that batches passages for the remote embedding model.
 *
 * <p>Passages are cut into batches of {@code rag.embedding.batch-size}. Batches are submitted to
 * the embedding executor and may complete in any order, but results are joined back strictly in
 * submission order, so vector {@code i} always belongs to text {@code i}. A batch that fails is
 * replaced with hashed vectors and counted as degraded; one bad batch never fails the call. A
 * batch the saturated executor refuses counts as failed.
 *
 * <p>Without a model client (provider "local") every vector comes from {@link
 * HashingEmbeddingGenerator} and nothing is reported as degraded.
 */
@Service
@Slf4j
public class EmbeddingService implements TextEmbedder {

  private final Optional<EmbeddingModelClient> modelClient;
  private final HashingEmbeddingGenerator fallbackGenerator;
  private final Executor embeddingExecutor;
  private final MeterRegistry meterRegistry;
  private final int batchSize;
  private final int dimensions;

  public EmbeddingService(
      Optional<EmbeddingModelClient> modelClient,
      HashingEmbeddingGenerator fallbackGenerator,
      RagConfig ragConfig,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      MeterRegistry meterRegistry) {
    this.modelClient = modelClient;
    this.fallbackGenerator = fallbackGenerator;
    this.embeddingExecutor = embeddingExecutor;
    this.meterRegistry = meterRegistry;
    this.batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    this.dimensions = ragConfig.getEmbedding().getDimensions();
  }

  @Override
  public EmbeddingBatch embedPassages(List<String> texts) {
    if (texts.isEmpty()) {
      return EmbeddingBatch.empty();
    }
    if (modelClient.isEmpty()) {
      return new EmbeddingBatch(fallbackGenerator.generateAll(texts), 0);
    }

    EmbeddingModelClient client = modelClient.get();
    List<List<String>> batches = partition(texts);
    List<CompletableFuture<EmbeddingBatch>> futures = new ArrayList<>(batches.size());
    for (List<String> batch : batches) {
      futures.add(submit(client, batch));
    }

    List<EmbeddingBatch> results = new ArrayList<>(batches.size());
    for (int i = 0; i < futures.size(); i++) {
      results.add(joinOrFallback(futures.get(i), batches.get(i), i));
    }

    EmbeddingBatch combined = EmbeddingBatch.concat(results);
    if (combined.degraded()) {
      log.warn(
          "{} of {} passages were embedded with fallback vectors",
          combined.fallbackCount(),
          texts.size());
    } else {
      log.debug("Embedded {} passages in {} batches", texts.size(), batches.size());
    }
    return combined;
  }

  @Override
  public float[] embedQuery(String query) {
    if (modelClient.isEmpty()) {
      return fallbackGenerator.generate(query);
    }
    try {
      return modelClient.get().embedQuery(query);
    } catch (RuntimeException e) {
      log.warn("Query embedding failed, using hashed fallback vector: {}", e.getMessage());
      meterRegistry
          .counter("embedding.fallback", "reason", e.getClass().getSimpleName())
          .increment();
      return fallbackGenerator.generate(query);
    }
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  /** A batch the executor rejects completes exceptionally and takes the fallback path. */
  private CompletableFuture<EmbeddingBatch> submit(
      EmbeddingModelClient client, List<String> batch) {
    try {
      return CompletableFuture.supplyAsync(() -> client.embedBatch(batch), embeddingExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private EmbeddingBatch joinOrFallback(
      CompletableFuture<EmbeddingBatch> future, List<String> batch, int batchIndex) {
    try {
      EmbeddingBatch result = future.join();
      if (result.size() != batch.size()) {
        throw new IllegalStateException(
            String.format(
                "Batch %d returned %d vectors for %d passages",
                batchIndex, result.size(), batch.size()));
      }
      return result;
    } catch (CompletionException | IllegalStateException e) {
      Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
      log.warn(
          "Embedding batch {} ({} passages) failed, using hashed fallback vectors: {}",
          batchIndex,
          batch.size(),
          cause.getMessage());
      meterRegistry
          .counter("embedding.fallback", "reason", cause.getClass().getSimpleName())
          .increment(batch.size());
      return new EmbeddingBatch(fallbackGenerator.generateAll(batch), batch.size());
    }
  }

  private List<List<String>> partition(List<String> texts) {
    List<List<String>> batches = new ArrayList<>();
    for (int start = 0; start < texts.size(); start += batchSize) {
      batches.add(List.copyOf(texts.subList(start, Math.min(texts.size(), start + batchSize))));
    }
    return batches;
  }
}
