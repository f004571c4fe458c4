package com.flamingo.ai.adaptiverag.domain.model;

import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of everything retrieved for the current question: knowledge-store items per
 * component and web search items. Citations are kept per item and may repeat across components;
 * deduplication happens when the context is assembled.
 */
public final class RetrievedEvidence {

  private static final RetrievedEvidence EMPTY =
      new RetrievedEvidence(new EnumMap<>(EvidenceComponent.class), List.of());

  private final Map<EvidenceComponent, List<EvidenceItem>> components;
  private final List<EvidenceItem> web;

  private RetrievedEvidence(
      Map<EvidenceComponent, List<EvidenceItem>> components, List<EvidenceItem> web) {
    EnumMap<EvidenceComponent, List<EvidenceItem>> copy = new EnumMap<>(EvidenceComponent.class);
    components.forEach((component, items) -> copy.put(component, List.copyOf(items)));
    this.components = Collections.unmodifiableMap(copy);
    this.web = List.copyOf(web);
  }

  public static RetrievedEvidence empty() {
    return EMPTY;
  }

  public static RetrievedEvidence ofComponents(
      Map<EvidenceComponent, List<EvidenceItem>> components) {
    return new RetrievedEvidence(components, List.of());
  }

  public static RetrievedEvidence ofWeb(List<EvidenceItem> web) {
    return new RetrievedEvidence(Map.of(), web);
  }

  /** Returns a copy whose knowledge-store components are replaced, keeping web items. */
  public RetrievedEvidence withComponents(Map<EvidenceComponent, List<EvidenceItem>> replacement) {
    return new RetrievedEvidence(replacement, web);
  }

  /** Returns a copy whose web items are replaced, keeping knowledge-store components. */
  public RetrievedEvidence withWeb(List<EvidenceItem> replacement) {
    return new RetrievedEvidence(components, replacement);
  }

  /** Items for a component in retrieval order; empty when the component was not retrieved. */
  public List<EvidenceItem> component(EvidenceComponent component) {
    return components.getOrDefault(component, List.of());
  }

  public Map<EvidenceComponent, List<EvidenceItem>> components() {
    return components;
  }

  public List<EvidenceItem> web() {
    return web;
  }

  public int knowledgeStoreItemCount() {
    return components.values().stream().mapToInt(List::size).sum();
  }

  public int totalItemCount() {
    return knowledgeStoreItemCount() + web.size();
  }

  public boolean isEmpty() {
    return totalItemCount() == 0;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RetrievedEvidence{");
    for (EvidenceComponent component : EvidenceComponent.values()) {
      sb.append(component.name().toLowerCase()).append('=').append(component(component).size());
      sb.append(", ");
    }
    return sb.append("web=").append(web.size()).append('}').toString();
  }
}
