package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import com.flamingo.ai.adaptiverag.service.knowledge.KnowledgeRetriever;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowOptions;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Retrieves knowledge-store evidence for the current question, replacing earlier evidence. */
@Component
@RequiredArgsConstructor
public class KnowledgeRetrievalStage implements WorkflowStage {

  private final KnowledgeRetriever knowledgeRetriever;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.KNOWLEDGE_RETRIEVAL;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    WorkflowOptions options = state.getOptions();
    RetrievedEvidence evidence =
        knowledgeRetriever.retrieve(
            state.getCurrentQuestion(), options.knowledgeStoreLimit(), options.components());
    state.replaceEvidence(evidence);
    return StageResult.outcome(StepOutcome.RETRIEVED)
        .count("items", evidence.knowledgeStoreItemCount())
        .build();
  }
}
