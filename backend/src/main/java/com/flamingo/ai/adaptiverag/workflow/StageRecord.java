package com.flamingo.ai.adaptiverag.workflow;

import java.util.Map;

/**
 * One executed stage in a run's trace.
 *
 * @param name stage name, see {@link WorkflowStep#getStageName()}
 * @param outcome edge taken out of the stage
 * @param durationMillis wall-clock time spent in the stage
 * @param counts stage-specific summary counts (items retrieved, kept, retry counters, ...)
 */
public record StageRecord(
    String name, StepOutcome outcome, long durationMillis, Map<String, Integer> counts) {

  public StageRecord {
    counts = counts == null ? Map.of() : Map.copyOf(counts);
  }
}
