package com.flamingo.ai.legalrag.exception;

/** Exception thrown when paragraphs cannot be written to an index during ingestion. */
public class IndexingException extends RuntimeException {

  public IndexingException(String message) {
    super(message);
  }

  public IndexingException(String message, Throwable cause) {
    super(message, cause);
  }
}
