package com.flamingo.ai.adaptiverag.service.grading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.adaptiverag.agent.UsefulnessGradingAgent;
import com.flamingo.ai.adaptiverag.agent.dto.UsefulnessGrade;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("UsefulnessVerifier Tests")
class UsefulnessVerifierTest {

  @Mock private UsefulnessGradingAgent agent;

  private UsefulnessVerifier verifier;

  @BeforeEach
  void setUp() {
    verifier = new UsefulnessVerifier(agent, new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should report answers that do not resolve the question")
  void shouldReturnGraderVerdict() {
    when(agent.grade("How do I treat patch canker?", "I don't know."))
        .thenReturn(new UsefulnessGrade(false, "no treatment given"));

    assertThat(verifier.verify("How do I treat patch canker?", "I don't know.")).isFalse();
  }

  @Test
  @DisplayName("Missing or failed verdict should count as useful")
  void shouldAcceptAnswerWhenGraderFails() {
    when(agent.grade(anyString(), anyString()))
        .thenReturn(null)
        .thenThrow(new RuntimeException("invalid JSON"));

    assertThat(verifier.verify("q", "a")).isTrue();
    assertThat(verifier.verify("q", "a")).isTrue();
  }
}
