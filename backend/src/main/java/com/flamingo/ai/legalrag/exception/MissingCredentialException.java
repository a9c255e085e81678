package com.flamingo.ai.legalrag.exception;

/** Thrown at startup when the reasoning engine or embedding provider has no credential. */
public class MissingCredentialException extends IllegalStateException {

  private final String variableName;

  public MissingCredentialException(String variableName) {
    super("OpenAI API key is required. Set " + variableName + " environment variable.");
    this.variableName = variableName;
  }

  public String getVariableName() {
    return variableName;
  }
}
