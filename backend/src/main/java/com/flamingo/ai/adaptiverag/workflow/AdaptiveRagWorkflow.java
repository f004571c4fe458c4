package com.flamingo.ai.adaptiverag.workflow;

import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.domain.model.Citation;
import com.flamingo.ai.adaptiverag.exception.InvalidWorkflowOptionsException;
import com.flamingo.ai.adaptiverag.service.context.ContextAssembler;
import com.flamingo.ai.adaptiverag.workflow.stage.WorkflowStage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one question through the adaptive RAG graph: route, retrieve, grade, refine, generate and
 * verify, following the {@link TransitionTable} built for the request's options.
 *
 * <p>Every run terminates. Retry loops are only entered through budgeted edges, and the loop
 * additionally refuses to execute more stages than the table's computed bound.
 */
@Service
@Slf4j
public class AdaptiveRagWorkflow {

  private final Map<WorkflowStep, WorkflowStage> stages;
  private final ContextAssembler contextAssembler;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public AdaptiveRagWorkflow(
      List<WorkflowStage> stageBeans,
      ContextAssembler contextAssembler,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    Map<WorkflowStep, WorkflowStage> byStep = new EnumMap<>(WorkflowStep.class);
    for (WorkflowStage stage : stageBeans) {
      if (byStep.put(stage.step(), stage) != null) {
        throw new IllegalStateException("Duplicate stage for " + stage.step());
      }
    }
    this.stages = byStep;
    this.contextAssembler = contextAssembler;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /** Options used when a caller does not supply its own. */
  public WorkflowOptions defaultOptions() {
    return WorkflowOptions.fromConfig(ragConfig);
  }

  public WorkflowResult run(String question) {
    return run(question, defaultOptions());
  }

  /**
   * Answers a question.
   *
   * @param question the user's question
   * @param options per-request options
   * @return the answer with its citations and stage trace
   * @throws InvalidWorkflowOptionsException if the question is blank or the options are invalid;
   *     no stage has run in that case
   */
  @Timed(value = "rag.workflow", description = "Time to run the adaptive RAG workflow")
  public WorkflowResult run(String question, WorkflowOptions options) {
    if (question == null || question.isBlank()) {
      throw new InvalidWorkflowOptionsException("question", "must not be blank");
    }
    if (options == null) {
      throw new InvalidWorkflowOptionsException("options", "must not be null");
    }
    options.validate();

    TransitionTable table = TransitionTable.forOptions(options);
    WorkflowState state = new WorkflowState(question.trim(), options);
    WorkflowTrace trace = new WorkflowTrace();
    meterRegistry.counter("rag.workflow.runs").increment();

    WorkflowStep step = WorkflowStep.ROUTE_QUESTION;
    while (!step.isTerminal()) {
      if (trace.size() >= table.maxStageExecutions()) {
        throw new IllegalStateException(
            "Workflow exceeded " + table.maxStageExecutions() + " stage executions");
      }
      WorkflowStage stage = stages.get(step);
      if (stage == null) {
        throw new IllegalStateException("No stage registered for " + step);
      }

      long start = System.nanoTime();
      StageResult result = stage.execute(state);
      long durationMillis = (System.nanoTime() - start) / 1_000_000;

      trace.append(
          new StageRecord(step.getStageName(), result.outcome(), durationMillis, result.counts()));
      log.info(
          "[{}] outcome={} duration={}ms counts={}",
          step.getStageName(),
          result.outcome(),
          durationMillis,
          result.counts());

      step = table.next(step, result.outcome());
    }

    if (state.isBestEffort()) {
      meterRegistry.counter("rag.workflow.best_effort").increment();
    }

    String answer = state.answer().orElse(ragConfig.getGeneration().getFallbackAnswer());
    List<Citation> citations = contextAssembler.citationsOf(state.getEvidence());
    log.info(
        "Workflow complete: route={}, stages={}, refinements={}, regenerations={}, bestEffort={}",
        state.getRoute(),
        trace.size(),
        state.getQueryRefinements(),
        state.getRegenerations(),
        state.isBestEffort());

    return new WorkflowResult(
        answer,
        citations,
        trace.records(),
        state.getRoute(),
        state.getCurrentQuestion(),
        state.isBestEffort(),
        state.getQueryRefinements(),
        state.getRegenerations());
  }
}
