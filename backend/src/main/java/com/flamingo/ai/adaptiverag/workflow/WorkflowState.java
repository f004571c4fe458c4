package com.flamingo.ai.adaptiverag.workflow;

import com.flamingo.ai.adaptiverag.domain.enums.Route;
import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;

/**
 * Request-scoped record threaded through every stage. Created fresh for each run with zeroed
 * counters and no evidence, discarded when the run terminates.
 */
@Getter
public class WorkflowState {

  private final String originalQuestion;
  private final WorkflowOptions options;

  private String currentQuestion;
  private Route route;
  private RetrievedEvidence evidence = RetrievedEvidence.empty();
  private String answer;
  private int queryRefinements;
  private int regenerations;
  private boolean webFallbackTaken;
  private boolean bestEffort;

  public WorkflowState(String originalQuestion, WorkflowOptions options) {
    this.originalQuestion = Objects.requireNonNull(originalQuestion, "originalQuestion");
    this.options = Objects.requireNonNull(options, "options");
    this.currentQuestion = originalQuestion;
  }

  public Optional<String> answer() {
    return Optional.ofNullable(answer);
  }

  /** Sets the route chosen by the router or by the one-shot web fallback. */
  public void setRoute(Route route) {
    this.route = Objects.requireNonNull(route, "route");
  }

  /** Replaces the working question. The original question is never touched. */
  public void refineQuestion(String refinedQuestion) {
    this.currentQuestion = Objects.requireNonNull(refinedQuestion, "refinedQuestion");
  }

  /** Only retrieval and relevance-grading stages replace evidence. */
  public void replaceEvidence(RetrievedEvidence evidence) {
    this.evidence = Objects.requireNonNull(evidence, "evidence");
  }

  public void setAnswer(String answer) {
    this.answer = Objects.requireNonNull(answer, "answer");
  }

  public int incrementQueryRefinements() {
    return ++queryRefinements;
  }

  public int incrementRegenerations() {
    return ++regenerations;
  }

  public boolean hasEvidence() {
    return !evidence.isEmpty();
  }

  /**
   * Switches to web search for the rest of the run. Throws if called twice so the fallback can
   * never loop.
   */
  public void takeWebFallback() {
    if (webFallbackTaken) {
      throw new IllegalStateException("Web search fallback already taken for this request");
    }
    webFallbackTaken = true;
    route = Route.WEB_SEARCH;
  }

  /** Marks the answer as returned despite a failed quality gate. */
  public void markBestEffort() {
    this.bestEffort = true;
  }
}
