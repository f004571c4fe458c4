package com.flamingo.ai.adaptiverag.service.web;

import java.util.List;

/** Queries an external web search provider. */
public interface WebSearchClient {

  /**
   * @throws com.flamingo.ai.adaptiverag.exception.SearchException if the provider fails
   */
  List<WebSearchResult> search(String query, int limit);
}
