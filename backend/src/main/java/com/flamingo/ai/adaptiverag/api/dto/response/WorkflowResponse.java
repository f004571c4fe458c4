package com.flamingo.ai.adaptiverag.api.dto.response;

import com.flamingo.ai.adaptiverag.domain.model.Citation;
import com.flamingo.ai.adaptiverag.workflow.StageRecord;
import com.flamingo.ai.adaptiverag.workflow.WorkflowResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a workflow run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowResponse {

  private String answer;
  private String question;
  private String route;
  private boolean bestEffort;
  private List<CitationResponse> citations;
  private List<StageResponse> trace;
  private Map<String, Object> metadata;

  /** A cited source; {@code url} is omitted for sources without one. */
  public record CitationResponse(String sourceId, String url) {

    static CitationResponse from(Citation citation) {
      return new CitationResponse(citation.sourceId(), citation.url());
    }
  }

  /** One executed stage. */
  public record StageResponse(
      String name, String outcome, long durationMillis, Map<String, Integer> details) {

    static StageResponse from(StageRecord record) {
      return new StageResponse(
          record.name(), record.outcome().name(), record.durationMillis(), record.counts());
    }
  }

  /** Creates a WorkflowResponse from a workflow result. */
  public static WorkflowResponse fromResult(String question, WorkflowResult result) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("finalQuestion", result.finalQuestion());
    metadata.put("queryRefinements", result.queryRefinements());
    metadata.put("regenerations", result.regenerations());
    metadata.put("stageCount", result.trace().size());
    metadata.put(
        "totalDurationMillis",
        result.trace().stream().mapToLong(StageRecord::durationMillis).sum());

    return WorkflowResponse.builder()
        .answer(result.answer())
        .question(question)
        .route(result.route() != null ? result.route().getLabel() : null)
        .bestEffort(result.bestEffort())
        .citations(result.citations().stream().map(CitationResponse::from).toList())
        .trace(result.trace().stream().map(StageResponse::from).toList())
        .metadata(metadata)
        .build();
  }
}
