package com.flamingo.ai.adaptiverag.service.knowledge;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.adaptiverag.config.RagConfig;
import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.Citation;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.exception.SearchException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Knowledge store backed by Elasticsearch, one index per evidence component. Each index is queried
 * with a {@code multi_match} on its content field.
 *
 * <p>Every component has its own circuit breaker ({@code knowledge-store-<component>}, all sharing
 * the {@code knowledge-store} configuration), so a failing index only short-circuits itself.
 */
@Service
@Slf4j
public class ElasticsearchKnowledgeStoreClient implements KnowledgeStoreClient {

  static final String BREAKER_CONFIG = "knowledge-store";

  private final ElasticsearchClient elasticsearchClient;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Map<EvidenceComponent, CircuitBreaker> breakers =
      new EnumMap<>(EvidenceComponent.class);

  public ElasticsearchKnowledgeStoreClient(
      ElasticsearchClient elasticsearchClient,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    for (EvidenceComponent component : EvidenceComponent.values()) {
      breakers.put(
          component,
          circuitBreakerRegistry.circuitBreaker(breakerName(component), BREAKER_CONFIG));
    }
  }

  static String breakerName(EvidenceComponent component) {
    return BREAKER_CONFIG + "-" + component.name().toLowerCase(Locale.ROOT);
  }

  @Override
  @Timed(value = "knowledge_store.search", description = "Time to search one knowledge component")
  public List<EvidenceItem> search(EvidenceComponent component, String query, int limit) {
    RagConfig.KnowledgeStore.Component mapping = mappingFor(component);
    try {
      return breakers
          .get(component)
          .executeSupplier(() -> searchIndex(component, mapping, query, limit));
    } catch (CallNotPermittedException e) {
      return searchFallback(component, e);
    }
  }

  private List<EvidenceItem> searchIndex(
      EvidenceComponent component,
      RagConfig.KnowledgeStore.Component mapping,
      String query,
      int limit) {
    try {
      SearchRequest request = buildSearchRequest(mapping, query, limit);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<EvidenceItem> items = mapHits(mapping, response.hits().hits());
      log.debug(
          "[knowledgeStore] component={} index={} query='{}' returned={}",
          component,
          mapping.getIndex(),
          query,
          items.size());
      meterRegistry.counter("knowledge_store.search", "component", component.name()).increment();
      return items;
    } catch (IOException | ElasticsearchException e) {
      log.error("Search failed for {} ({}): {}", component, mapping.getIndex(), e.getMessage());
      throw new SearchException("knowledge_store", "Search failed for " + component, e);
    }
  }

  private List<EvidenceItem> searchFallback(EvidenceComponent component, Throwable t) {
    log.warn("Knowledge store fallback triggered for {}: {}", component, t.getMessage());
    meterRegistry
        .counter("knowledge_store.search.fallback", "component", component.name())
        .increment();
    return List.of();
  }

  private RagConfig.KnowledgeStore.Component mappingFor(EvidenceComponent component) {
    RagConfig.KnowledgeStore.Component mapping =
        ragConfig.getKnowledgeStore().getComponents().get(component);
    if (mapping == null || mapping.getIndex() == null || mapping.getContentField() == null) {
      throw new SearchException("knowledge_store", "No index configured for " + component);
    }
    return mapping;
  }

  private SearchRequest buildSearchRequest(
      RagConfig.KnowledgeStore.Component mapping, String query, int limit) {
    return SearchRequest.of(
        s ->
            s.index(mapping.getIndex())
                .size(limit)
                .query(
                    q -> q.multiMatch(m -> m.query(query).fields(mapping.getContentField()))));
  }

  @SuppressWarnings("rawtypes")
  private List<EvidenceItem> mapHits(
      RagConfig.KnowledgeStore.Component mapping, List<Hit<Map>> hits) {
    List<EvidenceItem> items = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map source = hit.source();
      if (source == null) {
        continue;
      }
      Object content = source.get(mapping.getContentField());
      if (content == null || content.toString().isBlank()) {
        continue;
      }
      Object sourceId = source.get(mapping.getSourceIdField());
      Object url = source.get(mapping.getUrlField());
      Citation citation =
          new Citation(
              sourceId != null ? sourceId.toString() : hit.id(),
              url != null ? url.toString() : null);
      items.add(new EvidenceItem(content.toString(), citation));
    }
    return items;
  }
}
