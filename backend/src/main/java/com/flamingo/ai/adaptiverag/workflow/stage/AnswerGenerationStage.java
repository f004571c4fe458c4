package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.domain.enums.Route;
import com.flamingo.ai.adaptiverag.service.context.AssembledContext;
import com.flamingo.ai.adaptiverag.service.context.ContextAssembler;
import com.flamingo.ai.adaptiverag.service.generation.AnswerGenerator;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Generates the answer. Retrieval routes answer the original question from the assembled context;
 * the internal-knowledge route answers the current question without context.
 */
@Component
@RequiredArgsConstructor
public class AnswerGenerationStage implements WorkflowStage {

  private final AnswerGenerator answerGenerator;
  private final ContextAssembler contextAssembler;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.ANSWER_GENERATION;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    if (state.getRoute() == Route.INTERNAL_KNOWLEDGE) {
      state.setAnswer(answerGenerator.generateDirectly(state.getCurrentQuestion()));
      return StageResult.outcome(StepOutcome.GENERATED).count("context_items", 0).build();
    }

    AssembledContext context = contextAssembler.assemble(state.getEvidence());
    state.setAnswer(answerGenerator.generateWithContext(state.getOriginalQuestion(), context));
    return StageResult.outcome(StepOutcome.GENERATED)
        .count("context_items", state.getEvidence().totalItemCount())
        .count("citations", context.citations().size())
        .build();
  }
}
