package com.flamingo.ai.adaptiverag.workflow;

import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.RetryBudget;
import com.flamingo.ai.adaptiverag.exception.InvalidWorkflowOptionsException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;

/**
 * Per-request configuration of one workflow run: result limits, enabled knowledge-store
 * components, enabled optional stages and retry ceilings.
 */
@Builder(toBuilder = true)
public record WorkflowOptions(
    int knowledgeStoreLimit,
    int webSearchLimit,
    Set<EvidenceComponent> components,
    boolean relevanceGradingEnabled,
    boolean groundednessCheckEnabled,
    boolean usefulnessCheckEnabled,
    int maxQueryRefinements,
    int maxRegenerations) {

  public static final int MAX_RESULT_LIMIT = 10;
  public static final int MAX_RETRY_CEILING = 10;

  public WorkflowOptions {
    if (components != null && components.stream().anyMatch(Objects::isNull)) {
      throw new InvalidWorkflowOptionsException("components", "must not contain null entries");
    }
    components =
        components == null || components.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(components));
  }

  /** Builds the default options from application configuration. */
  public static WorkflowOptions fromConfig(RagConfig ragConfig) {
    RagConfig.Workflow workflow = ragConfig.getWorkflow();
    return WorkflowOptions.builder()
        .knowledgeStoreLimit(workflow.getKnowledgeStoreLimit())
        .webSearchLimit(workflow.getWebSearchLimit())
        .components(
            workflow.getComponents() == null || workflow.getComponents().isEmpty()
                ? EvidenceComponent.defaults()
                : EnumSet.copyOf(workflow.getComponents()))
        .relevanceGradingEnabled(workflow.isRelevanceGradingEnabled())
        .groundednessCheckEnabled(workflow.isGroundednessCheckEnabled())
        .usefulnessCheckEnabled(workflow.isUsefulnessCheckEnabled())
        .maxQueryRefinements(workflow.getMaxQueryRefinements())
        .maxRegenerations(workflow.getMaxRegenerations())
        .build();
  }

  /**
   * Rejects invalid or conflicting options.
   *
   * @throws InvalidWorkflowOptionsException on the first violation found
   */
  public WorkflowOptions validate() {
    checkRange("knowledgeStoreLimit", knowledgeStoreLimit, 1, MAX_RESULT_LIMIT);
    checkRange("webSearchLimit", webSearchLimit, 1, MAX_RESULT_LIMIT);
    checkRange("maxQueryRefinements", maxQueryRefinements, 0, MAX_RETRY_CEILING);
    checkRange("maxRegenerations", maxRegenerations, 0, MAX_RETRY_CEILING);
    if (components.isEmpty()) {
      throw new InvalidWorkflowOptionsException(
          "components", "at least one knowledge-store component must be enabled");
    }
    return this;
  }

  public RetryBudget refinementBudget() {
    return new RetryBudget(maxQueryRefinements);
  }

  public RetryBudget regenerationBudget() {
    return new RetryBudget(maxRegenerations);
  }

  /** Enabled post-generation gates in the order they run. */
  public List<WorkflowStep> qualityGates() {
    List<WorkflowStep> gates = new ArrayList<>(2);
    if (groundednessCheckEnabled) {
      gates.add(WorkflowStep.GROUNDEDNESS_CHECK);
    }
    if (usefulnessCheckEnabled) {
      gates.add(WorkflowStep.USEFULNESS_CHECK);
    }
    return List.copyOf(gates);
  }

  private static void checkRange(String field, int value, int min, int max) {
    if (value < min || value > max) {
      throw new InvalidWorkflowOptionsException(
          field, String.format("must be between %d and %d, got %d", min, max, value));
    }
  }
}
