package com.flamingo.ai.adaptiverag.service.grading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.adaptiverag.agent.RelevanceGradingAgent;
import com.flamingo.ai.adaptiverag.agent.dto.RelevanceGrade;
import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.Citation;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
@DisplayName("RelevanceFilter Tests")
class RelevanceFilterTest {

  private static final String QUESTION = "What causes durian leaf curl?";

  @Mock private RelevanceGradingAgent agent;

  private ExecutorService executor;
  private MeterRegistry meterRegistry;
  private RelevanceFilter filter;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    meterRegistry = new SimpleMeterRegistry();
    filter = new RelevanceFilter(agent, executor, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static RetrievedEvidence evidence(EvidenceItem... entities) {
    Map<EvidenceComponent, List<EvidenceItem>> components = new EnumMap<>(EvidenceComponent.class);
    components.put(EvidenceComponent.ENTITIES, List.of(entities));
    return RetrievedEvidence.ofComponents(components);
  }

  @Test
  @DisplayName("Should keep relevant items in order with their own citations")
  void shouldFilterContentAndCitationsTogether() {
    EvidenceItem leafhopper = new EvidenceItem("Leafhopper", Citation.of("pests.pdf"));
    EvidenceItem fertilizer = new EvidenceItem("NPK fertilizer", Citation.of("soil.pdf"));
    EvidenceItem curl = new EvidenceItem("Leaf curl symptoms", Citation.of("symptoms.pdf"));
    when(agent.grade(QUESTION, "Leafhopper")).thenReturn(new RelevanceGrade(true));
    when(agent.grade(QUESTION, "NPK fertilizer")).thenReturn(new RelevanceGrade(false));
    when(agent.grade(QUESTION, "Leaf curl symptoms")).thenReturn(new RelevanceGrade(true));

    RetrievedEvidence filtered = filter.filter(QUESTION, evidence(leafhopper, fertilizer, curl));

    assertThat(filtered.component(EvidenceComponent.ENTITIES)).containsExactly(leafhopper, curl);
  }

  @Test
  @DisplayName("Grading failure should keep the item")
  void shouldKeepItemWhenGradingFails() {
    EvidenceItem item = new EvidenceItem("Leafhopper", Citation.of("pests.pdf"));
    when(agent.grade(anyString(), anyString())).thenThrow(new RuntimeException("rate limited"));

    RetrievedEvidence filtered = filter.filter(QUESTION, evidence(item));

    assertThat(filtered.component(EvidenceComponent.ENTITIES)).containsExactly(item);
    assertThat(meterRegistry.counter("rag.grading.relevance.errors").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Web items should pass through without grading")
  void shouldNotGradeWebItems() {
    EvidenceItem entity = new EvidenceItem("Leafhopper", Citation.of("pests.pdf"));
    EvidenceItem web = new EvidenceItem("Outbreak news", Citation.of("News"));
    when(agent.grade(eq(QUESTION), eq("Leafhopper"))).thenReturn(new RelevanceGrade(false));

    RetrievedEvidence filtered = filter.filter(QUESTION, evidence(entity).withWeb(List.of(web)));

    assertThat(filtered.knowledgeStoreItemCount()).isZero();
    assertThat(filtered.web()).containsExactly(web);
    verify(agent).grade(QUESTION, "Leafhopper");
  }

  @Test
  @DisplayName("Saturated executor should fall back to grading on the calling thread")
  void shouldGradeInlineWhenExecutorRejects() {
    Executor saturated =
        task -> {
          throw new TaskRejectedException("pool saturated");
        };
    RelevanceFilter inline = new RelevanceFilter(agent, saturated, meterRegistry);
    EvidenceItem psyllid = new EvidenceItem("Durian psyllid", Citation.of("pests.pdf"));
    EvidenceItem rainfall = new EvidenceItem("Annual rainfall", Citation.of("climate.pdf"));
    when(agent.grade(QUESTION, "Durian psyllid")).thenReturn(new RelevanceGrade(true));
    when(agent.grade(QUESTION, "Annual rainfall")).thenReturn(new RelevanceGrade(false));

    RetrievedEvidence filtered = inline.filter(QUESTION, evidence(psyllid, rainfall));

    assertThat(filtered.component(EvidenceComponent.ENTITIES)).containsExactly(psyllid);
    assertThat(meterRegistry.counter("rag.grading.relevance.rejected").count()).isEqualTo(2.0);
  }
}
