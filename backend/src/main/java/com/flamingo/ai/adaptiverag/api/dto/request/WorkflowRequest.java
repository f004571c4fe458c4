package com.flamingo.ai.adaptiverag.api.dto.request;

import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.workflow.WorkflowOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for running the workflow. Every option is optional; a null field keeps the
 * configured default. Ranges are checked when the options are validated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRequest {

  @NotBlank(message = "Question is required")
  @Size(min = 1, max = 2000, message = "Question must be between 1 and 2000 characters")
  private String question;

  private Integer knowledgeStoreLimit;
  private Integer webSearchLimit;
  private Set<EvidenceComponent> components;
  private Boolean relevanceGradingEnabled;
  private Boolean groundednessCheckEnabled;
  private Boolean usefulnessCheckEnabled;
  private Integer maxQueryRefinements;
  private Integer maxRegenerations;

  /** Applies the overrides present in this request on top of the given defaults. */
  public WorkflowOptions toOptions(WorkflowOptions defaults) {
    WorkflowOptions.WorkflowOptionsBuilder builder = defaults.toBuilder();
    if (knowledgeStoreLimit != null) {
      builder.knowledgeStoreLimit(knowledgeStoreLimit);
    }
    if (webSearchLimit != null) {
      builder.webSearchLimit(webSearchLimit);
    }
    if (components != null) {
      builder.components(components);
    }
    if (relevanceGradingEnabled != null) {
      builder.relevanceGradingEnabled(relevanceGradingEnabled);
    }
    if (groundednessCheckEnabled != null) {
      builder.groundednessCheckEnabled(groundednessCheckEnabled);
    }
    if (usefulnessCheckEnabled != null) {
      builder.usefulnessCheckEnabled(usefulnessCheckEnabled);
    }
    if (maxQueryRefinements != null) {
      builder.maxQueryRefinements(maxQueryRefinements);
    }
    if (maxRegenerations != null) {
      builder.maxRegenerations(maxRegenerations);
    }
    return builder.build();
  }
}
