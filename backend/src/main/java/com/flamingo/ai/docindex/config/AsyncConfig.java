package com.flamingo.ai.docindex.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for work that runs off the request thread. */
@Configuration
public class AsyncConfig {

  /**
   * Runs embedding batches in parallel. Pool size bounds how many batches are in flight against
   * the embedding provider at once.
   */
  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor(
      @Value("${rag.embedding.parallel-batches:2}") int parallelBatches) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelBatches);
    executor.setMaxPoolSize(parallelBatches);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
