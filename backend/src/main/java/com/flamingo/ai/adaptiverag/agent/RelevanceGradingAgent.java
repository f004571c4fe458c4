package com.flamingo.ai.adaptiverag.agent;

import com.flamingo.ai.adaptiverag.agent.dto.RelevanceGrade;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent grading whether a single retrieved item is relevant to a question. */
public interface RelevanceGradingAgent {

  @SystemMessage(
      """
        You grade the relevance of one retrieved passage to a user question.
        If the passage contains keywords or meaning related to the question, it is relevant.
        The grade does not need to be strict; the goal is to remove clearly unrelated passages.

        Return JSON: {"relevant": true} or {"relevant": false}
        """)
  @UserMessage(
      """
        Retrieved passage:
        {{passage}}

        Question: {{question}}
        """)
  RelevanceGrade grade(@V("question") String question, @V("passage") String passage);
}
