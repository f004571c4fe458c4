package com.flamingo.ai.adaptiverag.service.generation;

import com.flamingo.ai.adaptiverag.agent.AnswerGenerationAgent;
import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.service.context.AssembledContext;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces the answer text. Never throws: when the model cannot be reached the configured apology
 * is returned instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerGenerator {

  private final AnswerGenerationAgent agent;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Context mode: answers the user's original question from retrieved evidence. */
  @Timed(value = "rag.generation", extraTags = {"mode", "context"})
  @CircuitBreaker(name = "llm", fallbackMethod = "generateWithContextFallback")
  public String generateWithContext(String originalQuestion, AssembledContext context) {
    try {
      String answer = agent.answerWithContext(originalQuestion, context.text());
      return checked(answer);
    } catch (Exception e) {
      return failed(e);
    }
  }

  /** Context-free mode: answers from the model's own knowledge. */
  @Timed(value = "rag.generation", extraTags = {"mode", "direct"})
  @CircuitBreaker(name = "llm", fallbackMethod = "generateDirectlyFallback")
  public String generateDirectly(String question) {
    try {
      String answer = agent.answerDirectly(ragConfig.getDomain().getDescription(), question);
      return checked(answer);
    } catch (Exception e) {
      return failed(e);
    }
  }

  @SuppressWarnings("unused")
  private String generateWithContextFallback(
      String originalQuestion, AssembledContext context, Throwable t) {
    log.warn("Answer generation fallback triggered: {}", t.getMessage());
    return ragConfig.getGeneration().getFallbackAnswer();
  }

  @SuppressWarnings("unused")
  private String generateDirectlyFallback(String question, Throwable t) {
    log.warn("Answer generation fallback triggered: {}", t.getMessage());
    return ragConfig.getGeneration().getFallbackAnswer();
  }

  private String checked(String answer) {
    if (answer == null || answer.isBlank()) {
      log.warn("Model returned an empty answer, using fallback answer");
      meterRegistry.counter("rag.generation.empty").increment();
      return ragConfig.getGeneration().getFallbackAnswer();
    }
    return answer.trim();
  }

  private String failed(Exception e) {
    log.error("Answer generation failed: {}", e.getMessage());
    meterRegistry.counter("rag.generation.errors").increment();
    return ragConfig.getGeneration().getFallbackAnswer();
  }
}
