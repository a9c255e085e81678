package com.flamingo.ai.legalrag.service.ingestion.model;

import lombok.Builder;

/**
 * Summary of one ingestion run.
 *
 * @param files source files read successfully
 * @param prepared paragraphs that passed cleaning and filtering
 * @param skipped paragraphs dropped as empty, too short or without a location
 * @param stored records written to the store and both indexes
 */
@Builder
public record IngestionReport(int files, int prepared, int skipped, int stored) {}
