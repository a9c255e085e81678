package com.flamingo.ai.legalrag.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String JUSTIFICATION_NOT_FOUND = "LOCATOR_001";
  public static final String MALFORMED_AGENT_OUTPUT = "LOCATOR_002";
  public static final String LOCATOR_TIMEOUT = "LOCATOR_003";
  public static final String VECTOR_DIMENSION_MISMATCH = "SEARCH_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
