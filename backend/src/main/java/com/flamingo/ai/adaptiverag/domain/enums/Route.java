package com.flamingo.ai.adaptiverag.domain.enums;

/** Evidence-sourcing strategy chosen for a question. */
public enum Route {
  /** In-domain question answerable from the curated knowledge store. */
  KNOWLEDGE_STORE("knowledge_store"),

  /** In-domain question that needs current information from the web. */
  WEB_SEARCH("web_search"),

  /** Out-of-domain question; retrieval is bypassed and the model answers directly. */
  INTERNAL_KNOWLEDGE("internal_knowledge");

  private final String label;

  Route(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
