package com.flamingo.ai.adaptiverag.workflow;

import com.flamingo.ai.adaptiverag.domain.enums.Route;
import com.flamingo.ai.adaptiverag.domain.model.Citation;
import java.util.List;

/**
 * Result of one workflow run.
 *
 * @param answer final answer, never null
 * @param citations deduplicated citations of the context the answer was generated from
 * @param trace ordered stage executions
 * @param route route in effect when the run terminated
 * @param finalQuestion working question after any refinement
 * @param bestEffort true when a quality gate failed and its retry budget was exhausted
 * @param queryRefinements number of query refinements performed
 * @param regenerations number of regenerations requested by the groundedness gate
 */
public record WorkflowResult(
    String answer,
    List<Citation> citations,
    List<StageRecord> trace,
    Route route,
    String finalQuestion,
    boolean bestEffort,
    int queryRefinements,
    int regenerations) {

  public WorkflowResult {
    citations = List.copyOf(citations);
    trace = List.copyOf(trace);
  }
}
