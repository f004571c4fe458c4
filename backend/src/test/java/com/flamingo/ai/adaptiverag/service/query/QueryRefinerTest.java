package com.flamingo.ai.adaptiverag.service.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.adaptiverag.agent.QueryRefinementAgent;
import com.flamingo.ai.adaptiverag.agent.dto.QueryRefinementResult;
import com.flamingo.ai.adaptiverag.config.RagConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryRefiner Tests")
class QueryRefinerTest {

  @Mock private QueryRefinementAgent agent;

  private RagConfig ragConfig;
  private MeterRegistry meterRegistry;
  private QueryRefiner refiner;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    refiner = new QueryRefiner(agent, ragConfig, meterRegistry);
  }

  @Test
  @DisplayName("Should return the refined question")
  void shouldReturnRefinedQuestion() {
    when(agent.refine("durian pests and diseases", "PC on trunk?"))
        .thenReturn(
            new QueryRefinementResult(
                "  What causes Phytophthora patch canker on durian trunks?  ", "expanded PC"));

    assertThat(refiner.refine("PC on trunk?"))
        .isEqualTo("What causes Phytophthora patch canker on durian trunks?");
    assertThat(meterRegistry.counter("rag.query_refinement.refined").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Blank refinement should keep the current question")
  void shouldKeepQuestionWhenRefinementBlank() {
    when(agent.refine(anyString(), anyString())).thenReturn(new QueryRefinementResult(" ", null));

    assertThat(refiner.refine("PC on trunk?")).isEqualTo("PC on trunk?");
  }

  @Test
  @DisplayName("Oversized refinement should be truncated")
  void shouldTruncateLongRefinement() {
    ragConfig.getQueryRefinement().setMaxQueryLength(10);
    when(agent.refine(anyString(), anyString()))
        .thenReturn(new QueryRefinementResult("durian patch canker treatment", null));

    assertThat(refiner.refine("PC?")).isEqualTo("durian pat");
  }

  @Test
  @DisplayName("Agent failure should keep the current question")
  void shouldKeepQuestionOnFailure() {
    when(agent.refine(anyString(), anyString())).thenThrow(new RuntimeException("timeout"));

    assertThat(refiner.refine("PC on trunk?")).isEqualTo("PC on trunk?");
    assertThat(meterRegistry.counter("rag.query_refinement.errors").count()).isEqualTo(1.0);
  }
}
