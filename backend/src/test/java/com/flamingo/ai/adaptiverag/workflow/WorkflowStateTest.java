package com.flamingo.ai.adaptiverag.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.domain.enums.Route;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowState Tests")
class WorkflowStateTest {

  private final WorkflowOptions options = WorkflowOptions.fromConfig(new RagConfig());

  @Test
  @DisplayName("New state should start empty with zeroed counters")
  void shouldStartEmpty() {
    WorkflowState state = new WorkflowState("What is durian dieback?", options);

    assertThat(state.getCurrentQuestion()).isEqualTo("What is durian dieback?");
    assertThat(state.hasEvidence()).isFalse();
    assertThat(state.answer()).isEmpty();
    assertThat(state.getQueryRefinements()).isZero();
    assertThat(state.getRegenerations()).isZero();
  }

  @Test
  @DisplayName("Refining should never overwrite the original question")
  void shouldKeepOriginalQuestion() {
    WorkflowState state = new WorkflowState("dieback?", options);

    state.refineQuestion("What causes durian branch dieback?");

    assertThat(state.getOriginalQuestion()).isEqualTo("dieback?");
    assertThat(state.getCurrentQuestion()).isEqualTo("What causes durian branch dieback?");
  }

  @Test
  @DisplayName("Web fallback should switch route and be taken only once")
  void shouldTakeWebFallbackOnce() {
    WorkflowState state = new WorkflowState("q", options);
    state.setRoute(Route.KNOWLEDGE_STORE);

    state.takeWebFallback();

    assertThat(state.getRoute()).isEqualTo(Route.WEB_SEARCH);
    assertThat(state.isWebFallbackTaken()).isTrue();
    assertThatThrownBy(state::takeWebFallback).isInstanceOf(IllegalStateException.class);
  }
}
