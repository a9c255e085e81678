package com.flamingo.ai.legalrag.config;

import com.flamingo.ai.legalrag.service.ingestion.IngestionService;
import com.flamingo.ai.legalrag.service.ingestion.model.IngestionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Startup bean that loads the raw data directory into the record store and both indexes.
 *
 * <p>Only active with {@code rag.ingestion.enabled=true}. A failed run stops application startup
 * so the service never answers from a partially built corpus.
 */
@Component
@ConditionalOnProperty(prefix = "rag.ingestion", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements CommandLineRunner {

  private final IngestionService ingestionService;

  @Override
  public void run(String... args) {
    log.info("Starting ingestion on startup...");
    IngestionReport report = ingestionService.ingestDirectory();
    if (report.stored() == 0) {
      log.warn("Ingestion stored no paragraphs; check rag.ingestion.source-dir");
    }
  }
}
