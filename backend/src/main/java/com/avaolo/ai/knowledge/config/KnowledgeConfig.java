package com.avaolo.ai.knowledge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for knowledge search, indexing and the information hierarchy. */
@Configuration
@ConfigurationProperties(prefix = "knowledge")
@Getter
@Setter
public class KnowledgeConfig {

  private Search search = new Search();
  private Defaults defaults = new Defaults();
  private Chunking chunking = new Chunking();
  private Upload upload = new Upload();
  private Hierarchy hierarchy = new Hierarchy();
  private ExternalSearch externalSearch = new ExternalSearch();

  @Getter
  @Setter
  public static class Search {
    private int defaultTopK = 5;
    private int maxTopK = 50;
    private int pesticideTopK = 3;
    private int cropProtectionTopK = 5;
  }

  /** Metadata values applied when a document or search hit does not carry its own. */
  @Getter
  @Setter
  public static class Defaults {
    private String language = "hr";
    private String source = "manual";
    private String unknownSource = "unknown";
  }

  @Getter
  @Setter
  public static class Chunking {
    private int size = 512;
    private int overlap = 50;
  }

  @Getter
  @Setter
  public static class Upload {
    private long maxFileSizeBytes = 50L * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Hierarchy {
    private int maxItemsPerLevel = 5;
  }

  @Getter
  @Setter
  public static class ExternalSearch {
    private boolean enabled = false;
    private String baseUrl = "https://api.perplexity.ai";
    private String apiKey = "";
    private String model = "sonar";
    private int maxTokens = 500;
    private int readTimeoutMs = 20000;
  }
}
