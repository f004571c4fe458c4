package com.flamingo.ai.adaptiverag.workflow;

/** States of the adaptive workflow. {@link #COMPLETE} is the only terminal state. */
public enum WorkflowStep {
  ROUTE_QUESTION("route_question"),
  KNOWLEDGE_RETRIEVAL("knowledge_retrieval"),
  WEB_SEARCH("web_search"),
  RELEVANCE_GRADING("relevance_grading"),
  QUERY_REFINEMENT("query_refinement"),
  ANSWER_GENERATION("answer_generation"),
  GROUNDEDNESS_CHECK("groundedness_check"),
  USEFULNESS_CHECK("usefulness_check"),
  COMPLETE("complete");

  private final String stageName;

  WorkflowStep(String stageName) {
    this.stageName = stageName;
  }

  /** Name used in trace records and logs. */
  public String getStageName() {
    return stageName;
  }

  public boolean isTerminal() {
    return this == COMPLETE;
  }
}
