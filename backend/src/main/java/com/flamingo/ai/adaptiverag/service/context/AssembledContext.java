package com.flamingo.ai.adaptiverag.service.context;

import com.flamingo.ai.adaptiverag.domain.model.Citation;
import java.util.List;

/**
 * Context text handed to the answer generator, plus the sources it was built from.
 *
 * @param text sectioned context with inline attribution
 * @param citations distinct sources in first-seen order
 * @param empty true when no evidence contributed to {@code text}
 */
public record AssembledContext(String text, List<Citation> citations, boolean empty) {

  public AssembledContext {
    citations = List.copyOf(citations);
  }
}
