package com.flamingo.ai.adaptiverag.service.knowledge;

import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import com.flamingo.ai.adaptiverag.domain.model.EvidenceItem;
import com.flamingo.ai.adaptiverag.domain.model.RetrievedEvidence;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans a question out to every enabled knowledge-store component in parallel. A failing component
 * contributes an empty list; its siblings are unaffected.
 */
@Service
@Slf4j
public class KnowledgeRetriever {

  private final KnowledgeStoreClient knowledgeStoreClient;
  private final Executor retrievalExecutor;
  private final MeterRegistry meterRegistry;

  public KnowledgeRetriever(
      KnowledgeStoreClient knowledgeStoreClient,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      MeterRegistry meterRegistry) {
    this.knowledgeStoreClient = knowledgeStoreClient;
    this.retrievalExecutor = retrievalExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Retrieves up to {@code limit} items per enabled component.
   *
   * @return evidence keyed by component, in component declaration order
   */
  @Timed(value = "rag.retrieval", description = "Time to retrieve from the knowledge store")
  public RetrievedEvidence retrieve(String question, int limit, Set<EvidenceComponent> components) {
    Map<EvidenceComponent, CompletableFuture<List<EvidenceItem>>> futures =
        new EnumMap<>(EvidenceComponent.class);
    for (EvidenceComponent component : new TreeSet<>(components)) {
      futures.put(component, searchAsync(component, question, limit));
    }

    Map<EvidenceComponent, List<EvidenceItem>> results = new EnumMap<>(EvidenceComponent.class);
    futures.forEach((component, future) -> results.put(component, future.join()));

    RetrievedEvidence evidence = RetrievedEvidence.ofComponents(results);
    log.info("Knowledge store retrieval for '{}': {}", question, evidence);
    return evidence;
  }

  private CompletableFuture<List<EvidenceItem>> searchAsync(
      EvidenceComponent component, String question, int limit) {
    try {
      return CompletableFuture.supplyAsync(
          () -> searchComponent(component, question, limit), retrievalExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Retrieval executor saturated, searching {} on the calling thread", component);
      meterRegistry.counter("rag.retrieval.rejected").increment();
      return CompletableFuture.completedFuture(searchComponent(component, question, limit));
    }
  }

  private List<EvidenceItem> searchComponent(
      EvidenceComponent component, String question, int limit) {
    try {
      List<EvidenceItem> items = knowledgeStoreClient.search(component, question, limit);
      return items != null ? items : List.of();
    } catch (Exception e) {
      log.warn("Retrieval of {} failed, continuing without it: {}", component, e.getMessage());
      meterRegistry
          .counter("rag.retrieval.component_errors", "component", component.name())
          .increment();
      return List.of();
    }
  }
}
