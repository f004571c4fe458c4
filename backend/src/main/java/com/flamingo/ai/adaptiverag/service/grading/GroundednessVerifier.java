package com.flamingo.ai.adaptiverag.service.grading;

import com.flamingo.ai.adaptiverag.agent.GroundednessGradingAgent;
import com.flamingo.ai.adaptiverag.agent.dto.GroundednessGrade;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Checks that an answer is supported by the context it was generated from. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroundednessVerifier {

  private final GroundednessGradingAgent agent;
  private final MeterRegistry meterRegistry;

  /**
   * Returns whether the answer is grounded in the context. A failed check counts as grounded.
   *
   * @param context the assembled context the answer was generated from
   * @param answer the generated answer
   */
  @Timed(value = "rag.grading.groundedness", description = "Time to verify groundedness")
  @CircuitBreaker(name = "llm", fallbackMethod = "verifyFallback")
  public boolean verify(String context, String answer) {
    try {
      GroundednessGrade grade = agent.grade(context, answer);
      if (grade == null) {
        return true;
      }
      log.debug("Groundedness: grounded={}, reasoning={}", grade.grounded(), grade.reasoning());
      meterRegistry
          .counter("rag.grading.groundedness", "grounded", String.valueOf(grade.grounded()))
          .increment();
      return grade.grounded();
    } catch (Exception e) {
      log.warn("Groundedness check failed, accepting answer: {}", e.getMessage());
      meterRegistry.counter("rag.grading.groundedness.errors").increment();
      return true;
    }
  }

  @SuppressWarnings("unused")
  private boolean verifyFallback(String context, String answer, Throwable t) {
    log.warn("Groundedness check fallback triggered: {}", t.getMessage());
    return true;
  }
}
