package com.flamingo.ai.adaptiverag.service.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the Tavily search API. */
@Component
@Slf4j
public class TavilyWebSearchClient implements WebSearchClient {

  private final WebClient webClient;
  private final String apiKey;
  private final String searchDepth;
  private final int readTimeoutMs;

  public TavilyWebSearchClient(RagConfig ragConfig) {
    RagConfig.WebSearch webSearch = ragConfig.getWebSearch();
    this.apiKey = webSearch.getApiKey();
    this.searchDepth = webSearch.getSearchDepth();
    this.readTimeoutMs = webSearch.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(webSearch.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Tavily web search client initialized: baseUrl={}", webSearch.getBaseUrl());
  }

  @Override
  @Timed(value = "web_search.search", description = "Time to query the web search provider")
  @CircuitBreaker(name = "web-search")
  public List<WebSearchResult> search(String query, int limit) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new SearchException("web_search", "Tavily API key is not configured");
    }
    TavilyResponse response;
    try {
      response =
          webClient
              .post()
              .uri("/search")
              .contentType(MediaType.APPLICATION_JSON)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
              .bodyValue(new TavilyRequest(query, limit, searchDepth))
              .retrieve()
              .bodyToMono(TavilyResponse.class)
              .timeout(Duration.ofMillis(readTimeoutMs))
              .block();
    } catch (Exception e) {
      throw new SearchException("web_search", "Tavily search failed: " + e.getMessage(), e);
    }
    if (response == null || response.results() == null) {
      return List.of();
    }
    return response.results().stream()
        .filter(r -> r.content() != null && !r.content().isBlank())
        .limit(limit)
        .map(r -> new WebSearchResult(r.content(), titleOf(r), r.url()))
        .toList();
  }

  private static String titleOf(TavilyResult result) {
    if (result.title() != null && !result.title().isBlank()) {
      return result.title();
    }
    return result.url() != null ? result.url() : "Untitled";
  }

  record TavilyRequest(
      String query,
      @JsonProperty("max_results") int maxResults,
      @JsonProperty("search_depth") String searchDepth) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResponse(List<TavilyResult> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResult(String title, String url, String content) {}
}
