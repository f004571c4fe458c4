package com.flamingo.ai.adaptiverag.workflow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a stage hands back to the orchestrator: the outcome selecting the next edge and summary
 * counts for the trace.
 */
public record StageResult(StepOutcome outcome, Map<String, Integer> counts) {

  public StageResult {
    counts = counts == null ? Map.of() : Map.copyOf(counts);
  }

  public static StageResult of(StepOutcome outcome) {
    return new StageResult(outcome, Map.of());
  }

  public static Builder outcome(StepOutcome outcome) {
    return new Builder(outcome);
  }

  /** Accumulates counts in insertion order. */
  public static final class Builder {
    private final StepOutcome outcome;
    private final Map<String, Integer> counts = new LinkedHashMap<>();

    private Builder(StepOutcome outcome) {
      this.outcome = outcome;
    }

    public Builder count(String name, int value) {
      counts.put(name, value);
      return this;
    }

    public StageResult build() {
      return new StageResult(outcome, counts);
    }
  }
}
