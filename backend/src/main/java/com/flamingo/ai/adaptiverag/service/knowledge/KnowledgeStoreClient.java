package com.flamingo.ai.adaptiverag.service.knowledge;

import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import java.util.List;

/** Searches one component of the curated knowledge store. Ranking is the store's concern. */
public interface KnowledgeStoreClient {

  /**
   * Searches a single evidence component.
   *
   * @param component the component to search
   * @param query the question text
   * @param limit maximum number of items to return
   * @return matching items, best first
   * @throws com.flamingo.ai.adaptiverag.exception.SearchException if the store cannot be queried
   */
  List<EvidenceItem> search(EvidenceComponent component, String query, int limit);
}
