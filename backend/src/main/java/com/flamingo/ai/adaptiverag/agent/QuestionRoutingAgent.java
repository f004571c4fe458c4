package com.flamingo.ai.adaptiverag.agent;

import com.flamingo.ai.adaptiverag.agent.dto.DomainCheckResult;
import com.flamingo.ai.adaptiverag.agent.dto.RecencyCheckResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent behind question routing. The two checks are separate calls so the recency check is
 * only paid for questions that are in the subject domain.
 */
public interface QuestionRoutingAgent {

  @SystemMessage(
      """
        You decide whether a user question belongs to a specialised subject domain.

        Subject domain: {{domain}}

        A question is in the domain when answering it needs knowledge about the subject
        domain itself (its organisms, symptoms, causes, treatments, prevention and so on).
        Greetings, small talk, general knowledge and unrelated topics are out of the domain.

        Return JSON with these fields:
        - inDomain (boolean)
        - reasoning (string) - one short sentence
        """)
  @UserMessage("""
        Question: {{question}}
        """)
  DomainCheckResult checkDomain(@V("domain") String domain, @V("question") String question);

  @SystemMessage(
      """
        You decide whether answering a question requires current information.

        Answer needsCurrentInformation=true when the question asks for the latest, newest,
        recent or current state of something, mentions a recent date or period, or implies
        that the answer changes over time (news, outbreaks this season, new products).
        Otherwise answer false: stable, encyclopaedic knowledge does not need current
        information.

        Return JSON with these fields:
        - needsCurrentInformation (boolean)
        - reasoning (string) - one short sentence
        """)
  @UserMessage("""
        Question: {{question}}
        """)
  RecencyCheckResult checkRecency(@V("question") String question);
}
