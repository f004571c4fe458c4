package com.flamingo.ai.adaptiverag.agent;

import com.flamingo.ai.adaptiverag.agent.dto.UsefulnessGrade;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent judging whether an answer actually resolves the user's question. */
public interface UsefulnessGradingAgent {

  @SystemMessage(
      """
        You assess whether an answer resolves a question.
        useful=true means a user asking this question would consider it answered.
        An answer that only says it does not know is not useful.

        Return JSON with these fields:
        - useful (boolean)
        - reasoning (string) - one short sentence
        """)
  @UserMessage(
      """
        Question:
        {{question}}

        Answer:
        {{answer}}
        """)
  UsefulnessGrade grade(@V("question") String question, @V("answer") String answer);
}
