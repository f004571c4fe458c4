package com.flamingo.ai.adaptiverag.domain.model;

import java.util.Objects;

/**
 * Source attribution for a piece of evidence. Two citations with the same {@code sourceId} are the
 * same source, whatever their URL.
 *
 * @param sourceId document name for knowledge-store evidence, page title for web evidence
 * @param url link to the source, null when the source has none
 */
public record Citation(String sourceId, String url) {

  public Citation {
    Objects.requireNonNull(sourceId, "sourceId");
  }

  public static Citation of(String sourceId) {
    return new Citation(sourceId, null);
  }

  public boolean hasUrl() {
    return url != null && !url.isBlank();
  }
}
