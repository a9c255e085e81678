package com.flamingo.ai.legalrag.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(JustificationNotFoundException.class)
  public ResponseEntity<ApiError> handleJustificationNotFound(
      JustificationNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter(
        ex.isIterationLimitExceeded() ? "iteration_limit_exceeded" : "justification_not_found");
    String errorId = generateErrorId();
    log.warn("Justification not found [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.JUSTIFICATION_NOT_FOUND,
        "Justification paragraph not found: " + ex.getMessage(),
        request);
  }

  @ExceptionHandler(MalformedAgentOutputException.class)
  public ResponseEntity<ApiError> handleMalformedAgentOutput(
      MalformedAgentOutputException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_agent_output");
    String errorId = generateErrorId();
    log.error(
        "Malformed agent output [{}]: {} (raw: {})", errorId, ex.getMessage(), ex.getRawOutput());

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.MALFORMED_AGENT_OUTPUT,
        "Could not parse the agent's final answer.",
        request);
  }

  @ExceptionHandler(LocatorTimeoutException.class)
  public ResponseEntity<ApiError> handleLocatorTimeout(
      LocatorTimeoutException ex, HttpServletRequest request) {

    incrementErrorCounter("locator_timeout");
    String errorId = generateErrorId();
    log.error(
        "Locator timeout [{}] after {} iteration(s): {}",
        errorId,
        ex.getCompletedIterations(),
        ex.getMessage());

    return build(
        HttpStatus.GATEWAY_TIMEOUT,
        errorId,
        ApiError.LOCATOR_TIMEOUT,
        "The request did not complete in time.",
        request);
  }

  @ExceptionHandler(DimensionMismatchException.class)
  public ResponseEntity<ApiError> handleDimensionMismatch(
      DimensionMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("vector_dimension_mismatch");
    String errorId = generateErrorId();
    log.error("Vector dimension mismatch [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.VECTOR_DIMENSION_MISMATCH,
        "Search is misconfigured: embedding dimensions do not match the vector index.",
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("llm_error");
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof MissingServletRequestParameterException missing
            ? missing.getParameterName() + ": parameter is required"
            : "Request body is missing or not valid JSON";
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
