package com.flamingo.ai.legalrag.service.rag.model;

/**
 * One entry of a single source's ranked list.
 *
 * @param id record id shared by the store and both indexes
 * @param rank 0-based position in the source list
 * @param rawScore source-specific score, only comparable within the same source
 */
public record SearchHit(long id, int rank, double rawScore) {}
