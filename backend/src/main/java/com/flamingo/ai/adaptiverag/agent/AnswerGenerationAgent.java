package com.flamingo.ai.adaptiverag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent producing the final answer, with or without retrieved context. */
public interface AnswerGenerationAgent {

  @SystemMessage(
      """
        You are an assistant for question-answering tasks. Answer the question using only
        the retrieved context below. The context is split into labelled sections; combine
        information across sections when it helps. If the context does not contain the
        answer, say so plainly instead of guessing. Keep the answer concise.
        """)
  @UserMessage(
      """
        Question: {{question}}

        Context:
        {{context}}

        Answer:
        """)
  String answerWithContext(@V("question") String question, @V("context") String context);

  @SystemMessage(
      """
        You are a helpful assistant specialised in {{domain}}. Answer the question concisely
        from your own knowledge. If the question is outside that specialty, answer briefly
        and mention that it is outside what you specialise in.
        """)
  @UserMessage("""
        Question: {{question}}
        """)
  String answerDirectly(@V("domain") String domain, @V("question") String question);
}
