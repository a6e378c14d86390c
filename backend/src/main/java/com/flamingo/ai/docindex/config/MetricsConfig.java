package com.flamingo.ai.docindex.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on chunking, embedding and retrieval entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name and store backend. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(
      @Value("${spring.application.name:doc-index}") String applicationName,
      RagConfig ragConfig) {
    return registry ->
        registry
            .config()
            .commonTags("application", applicationName, "store", ragConfig.getStore().getType());
  }
}
