package com.flamingo.ai.legalrag.exception;

/**
 * Exception thrown when the refinement loop ends without a justifying paragraph, either because
 * the reasoning engine reported failure or because the iteration budget ran out.
 */
public class JustificationNotFoundException extends RuntimeException {

  private final boolean iterationLimitExceeded;

  public JustificationNotFoundException(String reason, boolean iterationLimitExceeded) {
    super(reason);
    this.iterationLimitExceeded = iterationLimitExceeded;
  }

  public boolean isIterationLimitExceeded() {
    return iterationLimitExceeded;
  }
}
