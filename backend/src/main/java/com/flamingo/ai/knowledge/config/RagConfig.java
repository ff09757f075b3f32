package com.flamingo.ai.knowledge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval engine. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Ingestion ingestion = new Ingestion();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Chunking {
    /** Window size in characters. */
    private int size = 1000;

    /** Characters shared by consecutive windows; must be smaller than {@link #size}. */
    private int overlap = 200;

    /**
     * A sentence boundary is only used if it lies at least this far into the window, otherwise
     * the window is cut hard.
     */
    private double minBoundaryRatio = 0.5;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Remote provider: "openai" (default), "ollama", or "local" to run on the fallback only. */
    private String provider = "openai";

    /** Inputs longer than this are truncated before calling the remote provider. */
    private int maxInputChars = 5000;

    /** Timeout for a single remote embedding call. */
    private int timeoutSeconds = 30;

    /** Dimensions of the deterministic local fallback vectors. */
    private int fallbackDimensions = 384;

    private Ollama ollama = new Ollama();

    @Getter
    @Setter
    public static class Ollama {
      private String baseUrl = "http://localhost:11434";
      private String modelName = "nomic-embed-text";
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private double minSimilarity = 0.3;

    /** Number of search hits fetched before context assembly trims them to the token budget. */
    private int contextCandidates = 20;

    private int defaultMaxTokens = 2000;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int defaultPriority = 5;

    /** Subtracted from the requested priority of documents that are not admin-managed. */
    private int userPriorityPenalty = 2;
  }

  /** Configuration for source file artifacts kept alongside documents. */
  @Getter
  @Setter
  public static class Storage {
    /** Root directory under which uploaded source files live. */
    private String basePath = "data/knowledge";
  }
}
