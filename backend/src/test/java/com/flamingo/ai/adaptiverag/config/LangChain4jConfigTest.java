package com.flamingo.ai.adaptiverag.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

@DisplayName("LangChain4jConfig Tests")
class LangChain4jConfigTest {

  private LangChain4jConfig config;

  @BeforeEach
  void setUp() {
    config = new LangChain4jConfig();
    ReflectionTestUtils.setField(config, "baseUrl", "http://localhost:9999/v1");
    ReflectionTestUtils.setField(config, "chatModelName", "test-model");
    ReflectionTestUtils.setField(config, "maxCompletionTokens", 256);
    ReflectionTestUtils.setField(config, "timeoutSeconds", 5);
  }

  @Test
  @DisplayName("Missing API key should fail fast for both models")
  void shouldRequireApiKey() {
    ReflectionTestUtils.setField(config, "openAiApiKey", " ");

    assertThatThrownBy(() -> config.chatModel())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("OPENAI_API_KEY");
    assertThatThrownBy(() -> config.textChatModel()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Configured API key should build both models")
  void shouldBuildModels() {
    ReflectionTestUtils.setField(config, "openAiApiKey", "test-key");

    ChatModel jsonModel = config.chatModel();
    ChatModel textModel = config.textChatModel();

    assertThat(jsonModel).isNotNull();
    assertThat(textModel).isNotNull().isNotSameAs(jsonModel);
  }
}
