package com.flamingo.ai.adaptiverag.workflow;

/**
 * Edge labels of the workflow graph. An outcome is <em>budgeted</em> when the stage only emits it
 * after checking a retry counter against its ceiling; every cycle in the graph must contain at
 * least one budgeted edge.
 */
public enum StepOutcome {
  ROUTED_TO_KNOWLEDGE_STORE(false),
  ROUTED_TO_WEB_SEARCH(false),
  ROUTED_TO_INTERNAL_KNOWLEDGE(false),
  RETRIEVED(false),
  RELEVANT_EVIDENCE(false),
  /** Nothing relevant and the refinement budget allows another attempt. */
  REFINE(true),
  /** Nothing relevant and the refinement budget is spent: one-shot switch to web search. */
  FALLBACK_TO_WEB_SEARCH(false),
  RETRY_KNOWLEDGE_STORE(false),
  RETRY_WEB_SEARCH(false),
  RETRY_DIRECT_GENERATION(false),
  GENERATED(false),
  PASSED(false),
  /** Answer not grounded and the regeneration budget allows another attempt. */
  REGENERATE(true),
  /** Gate failed with its budget spent: the current answer is returned as best effort. */
  BUDGET_EXHAUSTED(false);

  private final boolean budgeted;

  StepOutcome(boolean budgeted) {
    this.budgeted = budgeted;
  }

  public boolean isBudgeted() {
    return budgeted;
  }
}
