package com.flamingo.ai.legalrag.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for retrieval, the refinement agent and ingestion. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Retrieval retrieval = new Retrieval();
  private Agent agent = new Agent();
  private Ingestion ingestion = new Ingestion();

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private int rrfK = 60;

    /** Upper bound for a single keyword or vector search, in milliseconds. */
    private long sourceTimeoutMs = 10000;
  }

  @Getter
  @Setter
  public static class Agent {
    /** Maximum number of reasoning turns that may request the search tool. */
    private int maxIterations = 5;

    /** Overall deadline for one locate request; checked between iterations. */
    private long requestTimeoutSeconds = 180;

    private int maxQueryLength = 500;
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Run ingestion once on application startup. */
    private boolean enabled = false;

    private String sourceDir = "raw_data";

    /** Cleaned paragraphs shorter than this are treated as noise and skipped. */
    private int minParagraphLength = 30;

    private int batchSize = 64;

    /** Drop existing records and indexes before ingesting. */
    private boolean recreate = true;
  }
}
