package com.flamingo.ai.legalrag.service.ingestion.model;

import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;

/** A cleaned paragraph ready to be stored and indexed. */
public record PreparedParagraph(String text, ParagraphLocation location) {}
