package com.flamingo.ai.legalrag.service.ingestion;

import com.flamingo.ai.legalrag.service.ingestion.model.IngestionReport;
import com.flamingo.ai.legalrag.service.ingestion.model.PreparedParagraph;
import com.flamingo.ai.legalrag.service.ingestion.model.RawDocument;
import java.nio.file.Path;
import java.util.List;

/** Service interface for loading legal documents into the record store and both indexes. */
public interface IngestionService {

  /**
   * Ingests every document of the configured source directory.
   *
   * @return counts for the run
   * @throws com.flamingo.ai.legalrag.exception.IndexingException if a batch cannot be indexed
   */
  IngestionReport ingestDirectory();

  /** Same as {@link #ingestDirectory()} for an explicit directory. */
  IngestionReport ingestDirectory(Path sourceDir);

  /**
   * Cleans and filters the paragraphs of one document.
   *
   * @param document raw document
   * @return paragraphs that are long enough and carry a full location
   */
  List<PreparedParagraph> prepare(RawDocument document);

  /**
   * Stores and indexes the paragraphs in batches. Each batch is written to all three stores or to
   * none of them.
   *
   * @return number of stored records
   */
  int ingest(List<PreparedParagraph> paragraphs);
}
