package com.flamingo.ai.adaptiverag.config;

import com.flamingo.ai.adaptiverag.domain.enums.EvidenceComponent;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the adaptive RAG workflow and its collaborators. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Domain domain = new Domain();
  private Workflow workflow = new Workflow();
  private QueryRefinement queryRefinement = new QueryRefinement();
  private Generation generation = new Generation();
  private KnowledgeStore knowledgeStore = new KnowledgeStore();
  private WebSearch webSearch = new WebSearch();

  @Getter
  @Setter
  public static class Domain {
    /** Subject domain the router treats as in scope. */
    private String description = "durian pests and diseases";
  }

  /** Defaults for {@code WorkflowOptions}; a request may override each of them. */
  @Getter
  @Setter
  public static class Workflow {
    private int knowledgeStoreLimit = 3;
    private int webSearchLimit = 3;
    private Set<EvidenceComponent> components = EvidenceComponent.defaults();

    /** Optional stages are off by default: fastest path, one generation per request. */
    private boolean relevanceGradingEnabled = false;

    private boolean groundednessCheckEnabled = false;
    private boolean usefulnessCheckEnabled = false;

    private int maxQueryRefinements = 3;
    private int maxRegenerations = 3;
  }

  @Getter
  @Setter
  public static class QueryRefinement {
    private int maxQueryLength = 500;
  }

  @Getter
  @Setter
  public static class Generation {
    /** Returned when answer generation itself fails. */
    private String fallbackAnswer =
        "I apologize, but I'm unable to answer that question at the moment.";
  }

  @Getter
  @Setter
  public static class KnowledgeStore {
    private Map<EvidenceComponent, Component> components = defaultComponents();

    /** Index layout of one evidence component. */
    @Getter
    @Setter
    public static class Component {
      private String index;
      private String contentField;
      private String sourceIdField = "source";
      private String urlField = "url";

      public Component() {}

      Component(String index, String contentField) {
        this.index = index;
        this.contentField = contentField;
      }
    }

    private static Map<EvidenceComponent, Component> defaultComponents() {
      Map<EvidenceComponent, Component> defaults = new EnumMap<>(EvidenceComponent.class);
      defaults.put(EvidenceComponent.ENTITIES, new Component("kg-entities", "summary"));
      defaults.put(EvidenceComponent.RELATIONSHIPS, new Component("kg-relationships", "fact"));
      defaults.put(EvidenceComponent.EPISODES, new Component("kg-episodes", "content"));
      defaults.put(EvidenceComponent.COMMUNITIES, new Component("kg-communities", "summary"));
      return defaults;
    }
  }

  /** Configuration for the Tavily web search API. */
  @Getter
  @Setter
  public static class WebSearch {
    private String baseUrl = "https://api.tavily.com";
    private String apiKey = "";
    private String searchDepth = "basic";
    private int readTimeoutMs = 15000;
  }
}
