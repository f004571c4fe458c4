package com.flamingo.ai.adaptiverag.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sub-kinds of knowledge-store content. Declaration order is the order in which components are
 * retrieved, merged and rendered into the assembled context.
 */
public enum EvidenceComponent {
  ENTITIES("KNOWLEDGE GRAPH ENTITIES (Key Concepts)", "Entity"),
  RELATIONSHIPS("KNOWLEDGE GRAPH RELATIONSHIPS (Connections)", "Relationship"),
  EPISODES("SOURCE PASSAGES (Document Excerpts)", "Passage"),
  COMMUNITIES("TOPIC SUMMARIES (Clustered Knowledge)", "Topic");

  private final String sectionTitle;
  private final String itemLabel;

  EvidenceComponent(String sectionTitle, String itemLabel) {
    this.sectionTitle = sectionTitle;
    this.itemLabel = itemLabel;
  }

  public String getSectionTitle() {
    return sectionTitle;
  }

  public String getItemLabel() {
    return itemLabel;
  }

  /** Components enabled when a request does not specify any. */
  public static Set<EvidenceComponent> defaults() {
    return EnumSet.of(ENTITIES, RELATIONSHIPS);
  }
}
