package com.flamingo.ai.adaptiverag.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for the workflow. Counters are recorded directly on the {@link MeterRegistry}; stage and
 * collaborator latencies ({@code rag.workflow}, {@code rag.retrieval}, {@code rag.grading.*},
 * {@code knowledge_store.search}, {@code web_search.search}) come from {@code @Timed}.
 */
@Configuration
public class MetricsConfig {

  /** Makes {@code @Timed} on workflow beans produce timers. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
