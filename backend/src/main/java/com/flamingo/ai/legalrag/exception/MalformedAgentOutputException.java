package com.flamingo.ai.legalrag.exception;

/** Exception thrown when the terminal answer of the reasoning engine cannot be interpreted. */
public class MalformedAgentOutputException extends RuntimeException {

  private final String rawOutput;

  public MalformedAgentOutputException(String message, String rawOutput) {
    super(message);
    this.rawOutput = rawOutput;
  }

  public String getRawOutput() {
    return rawOutput;
  }
}
