package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import com.flamingo.ai.adaptiverag.service.web.WebSearchRetriever;
import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.StepOutcome;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Retrieves web evidence for the current question, replacing earlier evidence. */
@Component
@RequiredArgsConstructor
public class WebSearchStage implements WorkflowStage {

  private final WebSearchRetriever webSearchRetriever;

  @Override
  public WorkflowStep step() {
    return WorkflowStep.WEB_SEARCH;
  }

  @Override
  public StageResult execute(WorkflowState state) {
    List<EvidenceItem> items =
        webSearchRetriever.retrieve(
            state.getCurrentQuestion(), state.getOptions().webSearchLimit());
    state.replaceEvidence(RetrievedEvidence.ofWeb(items));
    return StageResult.outcome(StepOutcome.RETRIEVED).count("items", items.size()).build();
  }
}
