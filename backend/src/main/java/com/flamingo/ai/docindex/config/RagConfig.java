package com.flamingo.ai.docindex.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the chunking and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Semantic semantic = new Semantic();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Store store = new Store();

  /** Default chunk sizing, in tokens. Requests may override any of these. */
  @Getter
  @Setter
  public static class Chunking {
    private int minChunkSize = 200;
    private int maxChunkSize = 500;
    private int targetChunkSize = 400;
    private int overlapPercentage = 10;
    private boolean preferSemanticBoundaries = true;
    private boolean respectSectionBoundaries = true;
    private boolean includeHeadingContext = true;

    /** Shrink the size bounds for short documents before chunking. */
    private boolean adaptiveSizing = true;
  }

  @Getter
  @Setter
  public static class Semantic {
    /** Adjacent similarity below this is at least a moderate boundary. */
    private double similarityThreshold = 0.7;

    /** Neighbours on each side used for the local similarity average. */
    private int windowSize = 3;

    /** Tokens that must precede a recommended split point. */
    private int minSegmentTokens = 100;

    /** Keyword-set overlap below this counts as a topic shift. */
    private double topicOverlapThreshold = 0.3;

    private int keywordCount = 5;

    /** Boundaries stronger than this are never merged across. */
    private double strongBoundaryStrength = 0.8;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** "openai" (LangChain4j model with hashed fallback) or "local" (hashed vectors only). */
    private String provider = "local";

    private int dimensions = 384;
    private int batchSize = 10;

    /** Batches sent to the provider concurrently; sizes the embedding executor. */
    private int parallelBatches = 2;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int maxResults = 10;
    private double similarityThreshold = 0.5;
    private int contextWindow = 2;

    /** Share of hybrid results taken from semantic retrieval; the rest is hierarchical. */
    private double semanticShare = 0.7;

    private double relatedSimilarityThreshold = 0.6;
    private int relatedMaxResults = 10;

    /** Chunks read per store round trip when filter-only strategies scan a project. */
    private int scanPageSize = 500;
  }

  @Getter
  @Setter
  public static class Store {
    /** "memory" or "elasticsearch". */
    private String type = "memory";
  }
}
