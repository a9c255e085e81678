package com.flamingo.ai.legalrag.service.rag.model;

/** A record id with its Reciprocal Rank Fusion score accumulated over all sources. */
public record FusedHit(long id, double fusedScore) {}
