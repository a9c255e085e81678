package com.flamingo.ai.legalrag.exception;

/** Exception thrown when a locate request passes its deadline or its thread is interrupted. */
public class LocatorTimeoutException extends RuntimeException {

  private final int completedIterations;

  public LocatorTimeoutException(String message, int completedIterations) {
    super(message);
    this.completedIterations = completedIterations;
  }

  public int getCompletedIterations() {
    return completedIterations;
  }
}
