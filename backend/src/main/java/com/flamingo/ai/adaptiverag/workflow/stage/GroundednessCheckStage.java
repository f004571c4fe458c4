package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.service.context.ContextAssembler;
import com.flamingo.ai.adaptiverag.service.grading.GroundednessVerifier;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Quality gate: regenerates an ungrounded answer while the regeneration budget allows it. An answer
 * generated without evidence has nothing to be grounded in and passes unchecked.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroundednessCheckStage implements WorkflowStage {

  private final GroundednessVerifier groundednessVerifier;
  private final ContextAssembler contextAssembler;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.GROUNDEDNESS_CHECK;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    if (!state.hasEvidence()) {
      return StageResult.outcome(StepOutcome.PASSED).count("skipped", 1).build();
    }

    String context = contextAssembler.assemble(state.getEvidence()).text();
    boolean grounded = groundednessVerifier.verify(context, state.getAnswer());

    StepOutcome outcome;
    if (grounded) {
      outcome = StepOutcome.PASSED;
    } else if (state.getOptions().regenerationBudget().allowsAnother(state.getRegenerations())) {
      state.incrementRegenerations();
      outcome = StepOutcome.REGENERATE;
    } else {
      log.info(
          "Answer still ungrounded after {} regenerations, returning best effort",
          state.getRegenerations());
      state.markBestEffort();
      outcome = StepOutcome.BUDGET_EXHAUSTED;
    }
    return StageResult.outcome(outcome).count("regenerations", state.getRegenerations()).build();
  }
}
