package com.flamingo.ai.legalrag.exception;

/** Exception thrown when the reasoning engine cannot be reached. */
public class LlmServiceException extends RuntimeException {

  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
