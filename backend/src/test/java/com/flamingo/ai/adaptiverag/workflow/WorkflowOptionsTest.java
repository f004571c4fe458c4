package com.flamingo.ai.adaptiverag.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.exception.InvalidWorkflowOptionsException;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowOptions Tests")
class WorkflowOptionsTest {

  private final WorkflowOptions defaults = WorkflowOptions.fromConfig(new RagConfig());

  @Test
  @DisplayName("Configured defaults should be the fastest mode")
  void shouldDefaultToFastestMode() {
    assertThat(defaults.knowledgeStoreLimit()).isEqualTo(3);
    assertThat(defaults.webSearchLimit()).isEqualTo(3);
    assertThat(defaults.components())
        .containsExactlyInAnyOrder(EvidenceComponent.ENTITIES, EvidenceComponent.RELATIONSHIPS);
    assertThat(defaults.relevanceGradingEnabled()).isFalse();
    assertThat(defaults.qualityGates()).isEmpty();
    assertThat(defaults.maxQueryRefinements()).isEqualTo(3);
    assertThat(defaults.maxRegenerations()).isEqualTo(3);
    assertThat(defaults.validate()).isSameAs(defaults);
  }

  @Test
  @DisplayName("Quality gates should be listed groundedness first")
  void shouldOrderQualityGates() {
    WorkflowOptions options =
        defaults.toBuilder().usefulnessCheckEnabled(true).groundednessCheckEnabled(true).build();

    assertThat(options.qualityGates())
        .containsExactly(WorkflowStep.GROUNDEDNESS_CHECK, WorkflowStep.USEFULNESS_CHECK);
  }

  @Test
  @DisplayName("Result limits outside 1..10 should be rejected")
  void shouldRejectOutOfRangeLimits() {
    assertThatThrownBy(() -> defaults.toBuilder().knowledgeStoreLimit(0).build().validate())
        .isInstanceOf(InvalidWorkflowOptionsException.class)
        .hasMessageContaining("knowledgeStoreLimit");
    assertThatThrownBy(() -> defaults.toBuilder().webSearchLimit(11).build().validate())
        .isInstanceOf(InvalidWorkflowOptionsException.class)
        .hasMessageContaining("webSearchLimit");
  }

  @Test
  @DisplayName("Negative or oversized ceilings should be rejected, zero accepted")
  void shouldValidateCeilings() {
    assertThatThrownBy(() -> defaults.toBuilder().maxQueryRefinements(-1).build().validate())
        .isInstanceOf(InvalidWorkflowOptionsException.class);
    assertThatThrownBy(() -> defaults.toBuilder().maxRegenerations(11).build().validate())
        .isInstanceOf(InvalidWorkflowOptionsException.class);

    WorkflowOptions zero = defaults.toBuilder().maxQueryRefinements(0).maxRegenerations(0).build();
    assertThat(zero.validate().refinementBudget().allowsAnother(0)).isFalse();
  }

  @Test
  @DisplayName("Empty component set should be rejected")
  void shouldRejectEmptyComponents() {
    assertThatThrownBy(() -> defaults.toBuilder().components(Set.of()).build().validate())
        .isInstanceOf(InvalidWorkflowOptionsException.class)
        .extracting("field")
        .isEqualTo("components");
  }

  @Test
  @DisplayName("Component set with a null entry should be rejected")
  void shouldRejectNullComponent() {
    Set<EvidenceComponent> components = new HashSet<>();
    components.add(EvidenceComponent.ENTITIES);
    components.add(null);

    assertThatThrownBy(() -> defaults.toBuilder().components(components).build())
        .isInstanceOf(InvalidWorkflowOptionsException.class)
        .extracting("field")
        .isEqualTo("components");
  }

  @Test
  @DisplayName("Component set should be copied defensively")
  void shouldCopyComponents() {
    EnumSet<EvidenceComponent> components = EnumSet.of(EvidenceComponent.EPISODES);
    WorkflowOptions options = defaults.toBuilder().components(components).build();

    components.add(EvidenceComponent.COMMUNITIES);

    assertThat(options.components()).containsExactly(EvidenceComponent.EPISODES);
  }
}
