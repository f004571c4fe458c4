package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.service.grading.UsefulnessVerifier;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Quality gate: judges the answer against the original question and asks for a refinement while
 * the refinement budget allows it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsefulnessCheckStage implements WorkflowStage {

  private final UsefulnessVerifier usefulnessVerifier;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.USEFULNESS_CHECK;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    boolean useful = usefulnessVerifier.verify(state.getOriginalQuestion(), state.getAnswer());

    StepOutcome outcome;
    if (useful) {
      outcome = StepOutcome.PASSED;
    } else if (state.getOptions().refinementBudget().allowsAnother(state.getQueryRefinements())) {
      outcome = StepOutcome.REFINE;
    } else {
      log.info(
          "Answer still not useful after {} refinements, returning best effort",
          state.getQueryRefinements());
      state.markBestEffort();
      outcome = StepOutcome.BUDGET_EXHAUSTED;
    }
    return StageResult.outcome(outcome)
        .count("query_refinements", state.getQueryRefinements())
        .build();
  }
}
