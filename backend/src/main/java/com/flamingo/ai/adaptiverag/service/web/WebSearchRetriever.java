package com.flamingo.ai.adaptiverag.service.web;

import com.flamingo.ai.adaptiverag.domain.model.Citation;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.exception.SearchException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Turns web search hits into evidence. Never throws: a provider failure means no web evidence. */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebSearchRetriever {

  private final WebSearchClient webSearchClient;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.web_search", description = "Time to retrieve web search evidence")
  public List<EvidenceItem> retrieve(String question, int limit) {
    try {
      List<WebSearchResult> results = webSearchClient.search(question, limit);
      if (results == null) {
        return List.of();
      }
      List<EvidenceItem> items =
          results.stream()
              .filter(r -> r.content() != null && r.title() != null)
              .map(r -> new EvidenceItem(r.content(), new Citation(r.title(), r.url())))
              .toList();
      log.info("Web search for '{}' returned {} results", question, items.size());
      return items;
    } catch (SearchException e) {
      log.warn("Web search failed at {} for '{}': {}", e.getSource(), question, e.getMessage());
      meterRegistry.counter("rag.web_search.errors").increment();
      return List.of();
    } catch (Exception e) {
      log.warn("Web search failed for '{}': {}", question, e.getMessage());
      meterRegistry.counter("rag.web_search.errors").increment();
      return List.of();
    }
  }
}
