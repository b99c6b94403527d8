package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.index.BackendType;
import com.flamingo.ai.deepresearch.index.PrunePolicy;
import com.flamingo.ai.deepresearch.service.evidence.CompressionMode;
import com.flamingo.ai.deepresearch.service.evidence.ValidationMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the research pipeline. */
@Configuration
@ConfigurationProperties(prefix = "research")
@Getter
@Setter
public class ResearchConfig {

  private int maxResearchLoops = 2;
  private int initialQueryCount = 3;
  private boolean requirePlanningConfirmation = true;

  /** Ceiling for compressed evidence, in estimated tokens. */
  private int tokenBudget = 50_000;

  /** How long a finished session stays in memory for late event subscribers. */
  private int sessionRetentionSeconds = 300;

  private Search search = new Search();
  private Index index = new Index();
  private Validation validation = new Validation();
  private Compression compression = new Compression();
  private Llm llm = new Llm();

  @Getter
  @Setter
  public static class Search {
    private List<String> providerPriority =
        new ArrayList<>(List.of("tavily", "brave", "google", "bing", "duckduckgo"));
    private int timeoutMs = 10_000;
    private int maxResults = 5;

    /** Upper bound for concurrent searches in one fan-out batch. */
    private int maxParallelism = 8;

    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Map<String, Provider> providers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class CircuitBreaker {
      private boolean enabled = false;
      private int failureThreshold = 3;
      private int windowSeconds = 60;
      private int openSeconds = 120;
    }

    @Getter
    @Setter
    public static class Provider {
      private String apiKey = "";
      private String baseUrl;

      /** Google Programmable Search engine id. */
      private String cx = "";
    }

    public Provider provider(String name) {
      return providers.computeIfAbsent(name, key -> new Provider());
    }
  }

  @Getter
  @Setter
  public static class Index {
    private boolean dualWrite = false;
    private BackendType readBackend = BackendType.MEMORY;
    private PrunePolicy prunePolicy = PrunePolicy.SOFT;
    private int chunkSize = 512;
    private int chunkOverlap = 50;
    private double reuseMinScore = 0.92;
    private boolean reuseEnabled = true;
    private boolean rebuildOnStartup = true;

    /** Page size for reading live chunks back from the durable backend during a rebuild. */
    private int rebuildPageSize = 1_000;
  }

  @Getter
  @Setter
  public static class Validation {
    private ValidationMode mode = ValidationMode.HYBRID;
    private boolean requireCitations = true;
    private double fuzzyCutoff = 0.8;
    private int minKeywordLength = 4;
  }

  @Getter
  @Setter
  public static class Compression {
    private boolean enabled = true;
    private CompressionMode mode = CompressionMode.TIERED;

    /** Snippets longer than this many characters are shortened in tiered mode. */
    private int maxSnippetChars = 1_200;
  }

  @Getter
  @Setter
  public static class Llm {
    private int maxAttempts = 3;
    private long backoffMs = 500;
  }
}
