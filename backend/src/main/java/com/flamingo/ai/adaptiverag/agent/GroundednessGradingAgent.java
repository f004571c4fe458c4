package com.flamingo.ai.adaptiverag.agent;

import com.flamingo.ai.adaptiverag.agent.dto.GroundednessGrade;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent checking an answer against the context it was generated from.
 *
 * <p>Guards against hallucinated statements: an answer is grounded only when its claims are
 * supported by the supplied facts.
 */
public interface GroundednessGradingAgent {

  @SystemMessage(
      """
        You are a fact-checking expert. Decide whether an answer is grounded in a set of facts.
        grounded=true means every substantive claim of the answer is supported by the facts.
        An answer that honestly says the facts are insufficient is grounded.

        Return JSON with these fields:
        - grounded (boolean)
        - reasoning (string) - one short sentence
        """)
  @UserMessage(
      """
        Facts:
        {{context}}

        Answer:
        {{answer}}
        """)
  GroundednessGrade grade(@V("context") String context, @V("answer") String answer);
}
