package com.flamingo.ai.adaptiverag.service.grading;

import com.flamingo.ai.adaptiverag.agent.UsefulnessGradingAgent;
import com.flamingo.ai.adaptiverag.agent.dto.UsefulnessGrade;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks that an answer resolves the question. Callers pass the user's original question, not a
 * refined one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsefulnessVerifier {

  private final UsefulnessGradingAgent agent;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.grading.usefulness", description = "Time to verify usefulness")
  @CircuitBreaker(name = "llm", fallbackMethod = "verifyFallback")
  public boolean verify(String originalQuestion, String answer) {
    try {
      UsefulnessGrade grade = agent.grade(originalQuestion, answer);
      if (grade == null) {
        return true;
      }
      log.debug("Usefulness: useful={}, reasoning={}", grade.useful(), grade.reasoning());
      meterRegistry
          .counter("rag.grading.usefulness", "useful", String.valueOf(grade.useful()))
          .increment();
      return grade.useful();
    } catch (Exception e) {
      log.warn("Usefulness check failed, accepting answer: {}", e.getMessage());
      meterRegistry.counter("rag.grading.usefulness.errors").increment();
      return true;
    }
  }

  @SuppressWarnings("unused")
  private boolean verifyFallback(String originalQuestion, String answer, Throwable t) {
    log.warn("Usefulness check fallback triggered: {}", t.getMessage());
    return true;
  }
}
