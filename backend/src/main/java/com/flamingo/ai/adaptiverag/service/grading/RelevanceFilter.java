package com.flamingo.ai.adaptiverag.service.grading;

import com.flamingo.ai.adaptiverag.agent.RelevanceGradingAgent;
import com.flamingo.ai.adaptiverag.agent.dto.RelevanceGrade;
import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drops knowledge-store items the model judges irrelevant to the question. Items are graded
 * independently and in parallel; the surviving items keep their original order and citations.
 */
@Service
@Slf4j
public class RelevanceFilter {

  private final RelevanceGradingAgent agent;
  private final Executor gradingExecutor;
  private final MeterRegistry meterRegistry;

  public RelevanceFilter(
      RelevanceGradingAgent agent,
      @Qualifier("gradingExecutor") Executor gradingExecutor,
      MeterRegistry meterRegistry) {
    this.agent = agent;
    this.gradingExecutor = gradingExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Grades every knowledge-store item against the question. Web items pass through untouched.
   *
   * @return evidence holding only the items graded relevant
   */
  @Timed(value = "rag.grading.relevance", description = "Time to grade retrieved evidence")
  public RetrievedEvidence filter(String question, RetrievedEvidence evidence) {
    Map<EvidenceComponent, List<CompletableFuture<Boolean>>> grades =
        new EnumMap<>(EvidenceComponent.class);
    evidence
        .components()
        .forEach(
            (component, items) -> {
              List<CompletableFuture<Boolean>> futures = new ArrayList<>(items.size());
              for (EvidenceItem item : items) {
                futures.add(gradeAsync(question, item));
              }
              grades.put(component, futures);
            });

    Map<EvidenceComponent, List<EvidenceItem>> kept = new EnumMap<>(EvidenceComponent.class);
    evidence
        .components()
        .forEach(
            (component, items) -> {
              List<CompletableFuture<Boolean>> futures = grades.get(component);
              List<EvidenceItem> relevant = new ArrayList<>();
              for (int i = 0; i < items.size(); i++) {
                if (futures.get(i).join()) {
                  relevant.add(items.get(i));
                }
              }
              kept.put(component, relevant);
            });

    RetrievedEvidence filtered = evidence.withComponents(kept);
    log.info(
        "Relevance grading kept {} of {} items",
        filtered.knowledgeStoreItemCount(),
        evidence.knowledgeStoreItemCount());
    return filtered;
  }

  private CompletableFuture<Boolean> gradeAsync(String question, EvidenceItem item) {
    try {
      return CompletableFuture.supplyAsync(() -> isRelevant(question, item), gradingExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Grading executor saturated, grading on the calling thread: {}", e.getMessage());
      meterRegistry.counter("rag.grading.relevance.rejected").increment();
      return CompletableFuture.completedFuture(isRelevant(question, item));
    }
  }

  private boolean isRelevant(String question, EvidenceItem item) {
    try {
      RelevanceGrade grade = agent.grade(question, item.content());
      return grade == null || grade.relevant();
    } catch (Exception e) {
      log.warn(
          "Relevance grading failed for source '{}', keeping item: {}",
          item.citation().sourceId(),
          e.getMessage());
      meterRegistry.counter("rag.grading.relevance.errors").increment();
      return true;
    }
  }
}
