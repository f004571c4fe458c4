package com.flamingo.ai.adaptiverag.agent;

import com.flamingo.ai.adaptiverag.agent.dto.QueryRefinementResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent rewriting a question into one that retrieves better from a knowledge graph. */
public interface QueryRefinementAgent {

  @SystemMessage(
      """
        You rewrite questions so that they retrieve better from a knowledge graph about
        {{domain}}.

        Rules:
        1. Keep the underlying intent of the question
        2. Expand abbreviations and informal names
        3. Add domain qualifiers when the question leaves them implicit
        4. Name the key entities and relationships explicitly
        5. Prefer precise terminology over colloquial wording
        6. Keep the rewritten question under 50 words

        Return JSON with these fields:
        - query (string) - the rewritten question
        - reasoning (string) - brief explanation of the changes
        """)
  @UserMessage("""
        Question: {{question}}
        """)
  QueryRefinementResult refine(@V("domain") String domain, @V("question") String question);
}
