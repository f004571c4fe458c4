package com.flamingo.ai.adaptiverag.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enum-keyed transition table of the workflow graph for one set of {@link WorkflowOptions}.
 *
 * <p>Optional stages are wired in or out when the table is built, so the orchestrator never
 * branches on configuration flags. Construction fails if the graph contains a cycle made only of
 * unbudgeted edges: together with monotonic retry counters this guarantees that every run
 * terminates.
 */
public final class TransitionTable {

  private final Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> transitions;
  private final int maxStageExecutions;

  private TransitionTable(
      Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> transitions, int maxStageExecutions) {
    this.transitions = transitions;
    this.maxStageExecutions = maxStageExecutions;
  }

  /**
   * Builds the table for the given options.
   *
   * @param options validated workflow options
   * @return the transition table
   * @throws IllegalStateException if the resulting graph has an unbudgeted cycle
   */
  public static TransitionTable forOptions(WorkflowOptions options) {
    Builder builder = new Builder();

    builder
        .on(WorkflowStep.ROUTE_QUESTION, StepOutcome.ROUTED_TO_KNOWLEDGE_STORE)
        .goTo(WorkflowStep.KNOWLEDGE_RETRIEVAL);
    builder
        .on(WorkflowStep.ROUTE_QUESTION, StepOutcome.ROUTED_TO_WEB_SEARCH)
        .goTo(WorkflowStep.WEB_SEARCH);
    builder
        .on(WorkflowStep.ROUTE_QUESTION, StepOutcome.ROUTED_TO_INTERNAL_KNOWLEDGE)
        .goTo(WorkflowStep.ANSWER_GENERATION);

    if (options.relevanceGradingEnabled()) {
      builder
          .on(WorkflowStep.KNOWLEDGE_RETRIEVAL, StepOutcome.RETRIEVED)
          .goTo(WorkflowStep.RELEVANCE_GRADING);
      builder
          .on(WorkflowStep.RELEVANCE_GRADING, StepOutcome.RELEVANT_EVIDENCE)
          .goTo(WorkflowStep.ANSWER_GENERATION);
      builder
          .on(WorkflowStep.RELEVANCE_GRADING, StepOutcome.REFINE)
          .goTo(WorkflowStep.QUERY_REFINEMENT);
      builder
          .on(WorkflowStep.RELEVANCE_GRADING, StepOutcome.FALLBACK_TO_WEB_SEARCH)
          .goTo(WorkflowStep.WEB_SEARCH);
    } else {
      builder
          .on(WorkflowStep.KNOWLEDGE_RETRIEVAL, StepOutcome.RETRIEVED)
          .goTo(WorkflowStep.ANSWER_GENERATION);
    }

    builder.on(WorkflowStep.WEB_SEARCH, StepOutcome.RETRIEVED).goTo(WorkflowStep.ANSWER_GENERATION);

    builder
        .on(WorkflowStep.QUERY_REFINEMENT, StepOutcome.RETRY_KNOWLEDGE_STORE)
        .goTo(WorkflowStep.KNOWLEDGE_RETRIEVAL);
    builder
        .on(WorkflowStep.QUERY_REFINEMENT, StepOutcome.RETRY_WEB_SEARCH)
        .goTo(WorkflowStep.WEB_SEARCH);
    builder
        .on(WorkflowStep.QUERY_REFINEMENT, StepOutcome.RETRY_DIRECT_GENERATION)
        .goTo(WorkflowStep.ANSWER_GENERATION);

    List<WorkflowStep> gates = options.qualityGates();
    builder
        .on(WorkflowStep.ANSWER_GENERATION, StepOutcome.GENERATED)
        .goTo(gates.isEmpty() ? WorkflowStep.COMPLETE : gates.get(0));

    for (int i = 0; i < gates.size(); i++) {
      WorkflowStep gate = gates.get(i);
      WorkflowStep next = i + 1 < gates.size() ? gates.get(i + 1) : WorkflowStep.COMPLETE;
      builder.on(gate, StepOutcome.PASSED).goTo(next);
      builder.on(gate, StepOutcome.BUDGET_EXHAUSTED).goTo(WorkflowStep.COMPLETE);
      if (gate == WorkflowStep.GROUNDEDNESS_CHECK) {
        builder.on(gate, StepOutcome.REGENERATE).goTo(WorkflowStep.ANSWER_GENERATION);
      } else if (gate == WorkflowStep.USEFULNESS_CHECK) {
        builder.on(gate, StepOutcome.REFINE).goTo(WorkflowStep.QUERY_REFINEMENT);
      }
    }

    Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> table = builder.build();
    verifyEveryCycleIsBudgeted(table);
    return new TransitionTable(
        table, stageExecutionBound(options.maxQueryRefinements(), options.maxRegenerations()));
  }

  /**
   * Resolves the successor of a step.
   *
   * @throws IllegalStateException if the step does not emit that outcome in this configuration
   */
  public WorkflowStep next(WorkflowStep from, StepOutcome outcome) {
    WorkflowStep target = transitions.getOrDefault(from, Map.of()).get(outcome);
    if (target == null) {
      throw new IllegalStateException(
          "No transition from " + from + " on " + outcome + " in this configuration");
    }
    return target;
  }

  /** Outcomes a step may emit in this configuration; empty when the step is not wired in. */
  public Set<StepOutcome> outcomesOf(WorkflowStep step) {
    Map<StepOutcome, WorkflowStep> edges = transitions.get(step);
    return edges == null ? Set.of() : Collections.unmodifiableSet(edges.keySet());
  }

  /** Steps reachable from {@link WorkflowStep#ROUTE_QUESTION}, terminal step included. */
  public Set<WorkflowStep> reachableSteps() {
    Set<WorkflowStep> visited = EnumSet.noneOf(WorkflowStep.class);
    collectReachable(WorkflowStep.ROUTE_QUESTION, visited);
    return visited;
  }

  /** Upper bound on the number of stage executions of any run using this table. */
  public int maxStageExecutions() {
    return maxStageExecutions;
  }

  /**
   * Every retrieval after the first is paid for by a refinement, plus at most one web fallback.
   * Every generation is either one of those arrivals or a paid regeneration, and each generation
   * is followed by at most two gate checks.
   */
  static int stageExecutionBound(int maxQueryRefinements, int maxRegenerations) {
    int retrievals = maxQueryRefinements + 2;
    int gradings = maxQueryRefinements + 1;
    int generations = maxQueryRefinements + 2 + maxRegenerations;
    return 1 + retrievals + gradings + maxQueryRefinements + generations * 3;
  }

  private void collectReachable(WorkflowStep step, Set<WorkflowStep> visited) {
    if (!visited.add(step)) {
      return;
    }
    for (WorkflowStep target : transitions.getOrDefault(step, Map.of()).values()) {
      collectReachable(target, visited);
    }
  }

  private static void verifyEveryCycleIsBudgeted(
      Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> table) {
    Map<WorkflowStep, Integer> marks = new EnumMap<>(WorkflowStep.class);
    for (WorkflowStep step : WorkflowStep.values()) {
      visitUnbudgeted(step, table, marks);
    }
  }

  // 1 = on the current DFS path, 2 = fully explored
  private static void visitUnbudgeted(
      WorkflowStep step,
      Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> table,
      Map<WorkflowStep, Integer> marks) {
    Integer mark = marks.get(step);
    if (mark != null) {
      if (mark == 1) {
        throw new IllegalStateException("Unbudgeted cycle through " + step);
      }
      return;
    }
    marks.put(step, 1);
    for (Map.Entry<StepOutcome, WorkflowStep> edge :
        table.getOrDefault(step, Map.of()).entrySet()) {
      if (!edge.getKey().isBudgeted()) {
        visitUnbudgeted(edge.getValue(), table, marks);
      }
    }
    marks.put(step, 2);
  }

  /** Collects edges and rejects duplicates. */
  static final class Builder {

    private final Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> table =
        new EnumMap<>(WorkflowStep.class);

    Edge on(WorkflowStep from, StepOutcome outcome) {
      return target -> {
        Map<StepOutcome, WorkflowStep> edges =
            table.computeIfAbsent(from, key -> new EnumMap<>(StepOutcome.class));
        if (edges.putIfAbsent(outcome, target) != null) {
          throw new IllegalStateException("Duplicate transition from " + from + " on " + outcome);
        }
        return this;
      };
    }

    Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> build() {
      Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> copy = new EnumMap<>(WorkflowStep.class);
      table.forEach((step, edges) -> copy.put(step, Collections.unmodifiableMap(edges)));
      return Collections.unmodifiableMap(copy);
    }

    TransitionTable buildVerified() {
      Map<WorkflowStep, Map<StepOutcome, WorkflowStep>> built = build();
      verifyEveryCycleIsBudgeted(built);
      return new TransitionTable(built, 0);
    }
  }

  @FunctionalInterface
  interface Edge {
    Builder goTo(WorkflowStep target);
  }
}
