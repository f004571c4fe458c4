package com.flamingo.ai.adaptiverag.domain.model;

import java.util.Objects;

/** One retrieved piece of content together with the citation it was retrieved from. */
public record EvidenceItem(String content, Citation citation) {

  public EvidenceItem {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(citation, "citation");
  }
}
