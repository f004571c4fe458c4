package com.flamingo.ai.adaptiverag.config;

import com.flamingo.ai.adaptiverag.agent.AnswerGenerationAgent;
import com.flamingo.ai.adaptiverag.agent.GroundednessGradingAgent;
import com.flamingo.ai.adaptiverag.agent.QueryRefinementAgent;
import com.flamingo.ai.adaptiverag.agent.QuestionRoutingAgent;
import com.flamingo.ai.adaptiverag.agent.RelevanceGradingAgent;
import com.flamingo.ai.adaptiverag.agent.UsefulnessGradingAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the workflow's AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public QuestionRoutingAgent questionRoutingAgent(ChatModel chatModel) {
    return AiServices.builder(QuestionRoutingAgent.class).chatModel(chatModel).build();
  }

  /** Called once per retrieved item, possibly from several grading threads at once. */
  @Bean
  public RelevanceGradingAgent relevanceGradingAgent(ChatModel chatModel) {
    return AiServices.builder(RelevanceGradingAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public GroundednessGradingAgent groundednessGradingAgent(ChatModel chatModel) {
    return AiServices.builder(GroundednessGradingAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public UsefulnessGradingAgent usefulnessGradingAgent(ChatModel chatModel) {
    return AiServices.builder(UsefulnessGradingAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public QueryRefinementAgent queryRefinementAgent(ChatModel chatModel) {
    return AiServices.builder(QueryRefinementAgent.class).chatModel(chatModel).build();
  }

  /**
   * Answer generation agent. Uses the non-JSON text model since the answer is free-form prose.
   */
  @Bean
  public AnswerGenerationAgent answerGenerationAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(AnswerGenerationAgent.class).chatModel(textChatModel).build();
  }
}
