package com.flamingo.ai.adaptiverag.service.routing;

import com.flamingo.ai.adaptiverag.agent.QuestionRoutingAgent;
import com.flamingo.ai.adaptiverag.agent.dto.DomainCheckResult;
import com.flamingo.ai.adaptiverag.agent.dto.RecencyCheckResult;
import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.domain.enums.Route;
import com.flamingo.ai.adaptiverag.exception.LlmServiceException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chooses how evidence is sourced for a question.
 *
 * <p>Out-of-domain questions are answered directly. In-domain questions go to web search when they
 * need current information and to the knowledge store otherwise. When classification fails the
 * question is answered directly so the workflow always makes progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionRouter {

  private final QuestionRoutingAgent agent;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.route", description = "Time to route a question")
  public Route route(String question) {
    Route route;
    try {
      route = classify(question);
    } catch (LlmServiceException e) {
      log.warn(
          "Question routing got no usable {} result, answering directly: {}",
          e.getTaskKind(),
          e.getMessage());
      meterRegistry.counter("rag.route.errors").increment();
      meterRegistry.counter("rag.route.unusable_result", "task", e.getTaskKind()).increment();
      route = Route.INTERNAL_KNOWLEDGE;
    } catch (Exception e) {
      log.warn("Question routing failed, answering directly: {}", e.getMessage());
      meterRegistry.counter("rag.route.errors").increment();
      route = Route.INTERNAL_KNOWLEDGE;
    }
    meterRegistry.counter("rag.route." + route.getLabel()).increment();
    log.info("Routed question '{}' to {}", question, route);
    return route;
  }

  private Route classify(String question) {
    DomainCheckResult domain =
        agent.checkDomain(ragConfig.getDomain().getDescription(), question);
    if (domain == null) {
      throw new LlmServiceException("domain_check", "Empty domain check result");
    }
    log.debug("Domain check: inDomain={}, reasoning={}", domain.inDomain(), domain.reasoning());
    if (!domain.inDomain()) {
      return Route.INTERNAL_KNOWLEDGE;
    }

    RecencyCheckResult recency = agent.checkRecency(question);
    if (recency == null) {
      throw new LlmServiceException("recency_check", "Empty recency check result");
    }
    log.debug(
        "Recency check: needsCurrentInformation={}, reasoning={}",
        recency.needsCurrentInformation(),
        recency.reasoning());
    return recency.needsCurrentInformation() ? Route.WEB_SEARCH : Route.KNOWLEDGE_STORE;
  }
}
