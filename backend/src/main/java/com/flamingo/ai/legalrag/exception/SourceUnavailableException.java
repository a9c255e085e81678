package com.flamingo.ai.legalrag.exception;

/**
 * Exception thrown when one retrieval backend (keyword or vector index) cannot answer. The hybrid
 * retriever absorbs it and continues with the remaining source.
 */
public class SourceUnavailableException extends RuntimeException {

  private final String source;

  public SourceUnavailableException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
