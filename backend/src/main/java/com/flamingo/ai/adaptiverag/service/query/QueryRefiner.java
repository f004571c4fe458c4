package com.flamingo.ai.adaptiverag.service.query;

import com.flamingo.ai.adaptiverag.agent.QueryRefinementAgent;
import com.flamingo.ai.adaptiverag.agent.dto.QueryRefinementResult;
import com.flamingo.ai.adaptiverag.config.RagConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Rewrites the current question into one that retrieves better. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRefiner {

  private final QueryRefinementAgent agent;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Refines the question. On failure the question comes back unchanged.
   *
   * @param currentQuestion the question used for the last retrieval
   * @return the refined question, never blank
   */
  @Timed(value = "rag.query_refinement", description = "Time to refine a question")
  @CircuitBreaker(name = "llm", fallbackMethod = "refineFallback")
  public String refine(String currentQuestion) {
    try {
      QueryRefinementResult result =
          agent.refine(ragConfig.getDomain().getDescription(), currentQuestion);
      if (result == null) {
        return currentQuestion;
      }
      log.debug("Query refinement reasoning: {}", result.reasoning());

      String refined = validateQuery(result.query(), currentQuestion);
      if (!refined.equals(currentQuestion)) {
        log.info("Refined question: '{}' → '{}'", currentQuestion, refined);
        meterRegistry.counter("rag.query_refinement.refined").increment();
      }
      return refined;
    } catch (Exception e) {
      log.warn("Query refinement failed, keeping question: {}", e.getMessage());
      meterRegistry.counter("rag.query_refinement.errors").increment();
      return currentQuestion;
    }
  }

  @SuppressWarnings("unused")
  private String refineFallback(String currentQuestion, Throwable t) {
    log.warn("Query refinement fallback triggered: {}", t.getMessage());
    return currentQuestion;
  }

  private String validateQuery(String refined, String currentQuestion) {
    if (refined == null || refined.isBlank()) {
      log.warn("Empty refined question, using current question");
      return currentQuestion;
    }
    String trimmed = refined.trim();
    int maxLength = ragConfig.getQueryRefinement().getMaxQueryLength();
    if (trimmed.length() > maxLength) {
      log.warn("Refined question too long ({} chars), truncating", trimmed.length());
      return trimmed.substring(0, maxLength);
    }
    return trimmed;
  }
}
