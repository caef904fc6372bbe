package com.flamingo.ai.mindmap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for mindmap generation. */
@Configuration
@ConfigurationProperties(prefix = "mindmap")
@Getter
@Setter
public class MindmapConfig {

  /** Language used when a request names none. */
  private String defaultLanguage = "English";

  private Clustering clustering = new Clustering();
  private Relationships relationships = new Relationships();
  private Generation generation = new Generation();
  private Embedding embedding = new Embedding();
  private Ingestion ingestion = new Ingestion();

  @Getter
  @Setter
  public static class Clustering {
    private int maxDepth = 3;
    private int minSize = 2;

    /** Upper bounds accepted for per-request overrides. */
    private int maxDepthLimit = 10;

    private int minSizeLimit = 100;

    /** Target rank of the truncated SVD applied before partitioning. */
    private int svdComponents = 50;

    /** Minimum group size as a fraction of the current subtree's sample count. */
    private double minClusterSizeRatio = 0.15;
  }

  @Getter
  @Setter
  public static class Relationships {
    private double similarityThreshold = 0.7;
    private int maxPerConcept = 5;
  }

  @Getter
  @Setter
  public static class Generation {
    /** Additional attempts after the first one. */
    private int maxRetries = 2;

    /** Minimum spacing between two calls to the text generation backend. */
    private long interCallDelayMs = 250;

    /** Member texts sampled per node for prompts. */
    private int sampleSize = 10;

    private int labelCharBudget = 2000;
    private int descriptionCharBudget = 4000;
    private int labelMaxWords = 10;
    private int descriptionMaxWords = 60;
  }

  @Getter
  @Setter
  public static class Embedding {
    private int batchSize = 16;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int minSegmentLength = 10;
    private int minDocumentLength = 10;

    /** Ceiling on segments per mindmap; Ward clustering is cubic in this number. */
    private int maxSegments = 2000;
  }
}
