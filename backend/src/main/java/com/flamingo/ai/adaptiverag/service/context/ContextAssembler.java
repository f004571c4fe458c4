package com.flamingo.ai.adaptiverag.service.context;

import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.Citation;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved evidence into one prompt context. Sections follow component declaration order
 * with web results last; every item is emitted with its source so the generator can attribute
 * provenance.
 */
@Component
public class ContextAssembler {

  static final String NO_CONTEXT = "No relevant context found in knowledge base or web search.";
  static final String WEB_SECTION_TITLE = "WEB SEARCH RESULTS (Recent Information)";
  static final String WEB_ITEM_LABEL = "Web Result";

  private static final String BANNER = "=".repeat(60);

  public AssembledContext assemble(RetrievedEvidence evidence) {
    if (evidence.isEmpty()) {
      return new AssembledContext(NO_CONTEXT, List.of(), true);
    }

    StringBuilder context = new StringBuilder();
    for (EvidenceComponent component : EvidenceComponent.values()) {
      appendSection(
          context,
          component.getSectionTitle(),
          component.getItemLabel(),
          evidence.component(component));
    }
    appendSection(context, WEB_SECTION_TITLE, WEB_ITEM_LABEL, evidence.web());

    return new AssembledContext(context.toString().trim(), citationsOf(evidence), false);
  }

  /** Distinct citations of all evidence, first occurrence wins. */
  public List<Citation> citationsOf(RetrievedEvidence evidence) {
    Map<String, Citation> bySourceId = new LinkedHashMap<>();
    for (EvidenceComponent component : EvidenceComponent.values()) {
      for (EvidenceItem item : evidence.component(component)) {
        bySourceId.putIfAbsent(item.citation().sourceId(), item.citation());
      }
    }
    for (EvidenceItem item : evidence.web()) {
      bySourceId.putIfAbsent(item.citation().sourceId(), item.citation());
    }
    return new ArrayList<>(bySourceId.values());
  }

  private void appendSection(
      StringBuilder context, String title, String itemLabel, List<EvidenceItem> items) {
    if (items.isEmpty()) {
      return;
    }
    context.append(BANNER).append('\n').append(title).append('\n').append(BANNER).append('\n');
    int index = 1;
    for (EvidenceItem item : items) {
      context.append('\n').append('[').append(itemLabel).append(' ').append(index++).append("]\n");
      context.append(item.content()).append('\n');
      context.append("  Source: ").append(item.citation().sourceId()).append('\n');
      if (item.citation().hasUrl()) {
        context.append("  URL: ").append(item.citation().url()).append('\n');
      }
    }
    context.append('\n');
  }
}
