package com.flamingo.ai.adaptiverag;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.adaptiverag.service.knowledge.KnowledgeStoreClient;
import com.flamingo.ai.adaptiverag.service.web.WebSearchClient;
import com.flamingo.ai.adaptiverag.workflow.AdaptiveRagWorkflow;
import com.flamingo.ai.adaptiverag.workflow.WorkflowOptions;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies that the Spring application context loads. External dependencies (LLM, Elasticsearch)
 * are mocked so the test runs without external services.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean(name = "chatModel")
  private ChatModel chatModel;

  @MockitoBean(name = "textChatModel")
  private ChatModel textChatModel;

  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Workflow and its clients should be wired")
  void workflowBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(AdaptiveRagWorkflow.class)).isNotNull();
    assertThat(applicationContext.getBean(KnowledgeStoreClient.class)).isNotNull();
    assertThat(applicationContext.getBean(WebSearchClient.class)).isNotNull();
  }

  @Test
  @DisplayName("Default options should come from application.yml")
  void defaultOptionsShouldBindFromConfiguration() {
    WorkflowOptions options =
        applicationContext.getBean(AdaptiveRagWorkflow.class).defaultOptions();

    assertThat(options.validate().knowledgeStoreLimit()).isEqualTo(3);
    assertThat(options.qualityGates()).isEmpty();
  }
}
