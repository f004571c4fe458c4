package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import com.flamingo.ai.adaptiverag.service.grading.RelevanceFilter;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Filters knowledge-store evidence. When nothing survives, asks for a refinement while the budget
 * allows it, then falls back to web search exactly once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelevanceGradingStage implements WorkflowStage {

  private final RelevanceFilter relevanceFilter;
  private final MeterRegistry meterRegistry;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.RELEVANCE_GRADING;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    RetrievedEvidence retrieved = state.getEvidence();
    RetrievedEvidence relevant = relevanceFilter.filter(state.getCurrentQuestion(), retrieved);
    state.replaceEvidence(relevant);

    StepOutcome outcome;
    if (relevant.knowledgeStoreItemCount() > 0) {
      outcome = StepOutcome.RELEVANT_EVIDENCE;
    } else if (state.getOptions().refinementBudget().allowsAnother(state.getQueryRefinements())) {
      outcome = StepOutcome.REFINE;
    } else {
      log.info(
          "No relevant evidence after {} refinements, falling back to web search",
          state.getQueryRefinements());
      state.takeWebFallback();
      meterRegistry.counter("rag.workflow.fallback.web_search").increment();
      outcome = StepOutcome.FALLBACK_TO_WEB_SEARCH;
    }

    return StageResult.outcome(outcome)
        .count("graded", retrieved.knowledgeStoreItemCount())
        .count("relevant", relevant.knowledgeStoreItemCount())
        .build();
  }
}
