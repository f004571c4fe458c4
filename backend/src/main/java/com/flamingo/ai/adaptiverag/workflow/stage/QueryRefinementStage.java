package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.service.query.QueryRefiner;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Refines the current question and sends it back to the source of the active route. Every
 * execution spends one refinement, whether or not the question actually changed.
 */
@Component
@RequiredArgsConstructor
public class QueryRefinementStage implements WorkflowStage {

  private final QueryRefiner queryRefiner;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.QUERY_REFINEMENT;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    String refined = queryRefiner.refine(state.getCurrentQuestion());
    state.refineQuestion(refined);
    int refinements = state.incrementQueryRefinements();

    StepOutcome outcome =
        switch (state.getRoute()) {
          case KNOWLEDGE_STORE -> StepOutcome.RETRY_KNOWLEDGE_STORE;
          case WEB_SEARCH -> StepOutcome.RETRY_WEB_SEARCH;
          case INTERNAL_KNOWLEDGE -> StepOutcome.RETRY_DIRECT_GENERATION;
        };
    return StageResult.outcome(outcome).count("query_refinements", refinements).build();
  }
}
