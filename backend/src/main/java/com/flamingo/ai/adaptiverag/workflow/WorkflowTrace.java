package com.flamingo.ai.adaptiverag.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered accumulator of stage executions for a single run. */
public final class WorkflowTrace {

  private final List<StageRecord> records = new ArrayList<>();

  public WorkflowTrace append(StageRecord record) {
    records.add(record);
    return this;
  }

  public int size() {
    return records.size();
  }

  /** Number of times the named step ran. */
  public long count(WorkflowStep step) {
    return records.stream().filter(r -> r.name().equals(step.getStageName())).count();
  }

  public List<StageRecord> records() {
    return Collections.unmodifiableList(records);
  }
}
