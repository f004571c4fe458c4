package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.domain.enums.Route;
import com.flamingo.ai.adaptiverag.service.routing.QuestionRouter;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RouteQuestionStage implements WorkflowStage {

  private final QuestionRouter questionRouter;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.ROUTE_QUESTION;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    Route route = questionRouter.route(state.getCurrentQuestion());
    state.setRoute(route);
    return StageResult.of(
        switch (route) {
          case KNOWLEDGE_STORE -> StepOutcome.ROUTED_TO_KNOWLEDGE_STORE;
          case WEB_SEARCH -> StepOutcome.ROUTED_TO_WEB_SEARCH;
          case INTERNAL_KNOWLEDGE -> StepOutcome.ROUTED_TO_INTERNAL_KNOWLEDGE;
        });
  }
}
