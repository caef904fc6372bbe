package com.flamingo.ai.mindmap.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps pipeline failures to {@link ApiError} responses. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ApiError> handleInvalidInput(
      InvalidInputException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_input");
    String errorId = generateErrorId();
    log.warn("Invalid input [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, ex.getMessage(), errorId,
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

    return build(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, errorId, request);
  }

  @ExceptionHandler(ProviderUnavailableException.class)
  public ResponseEntity<ApiError> handleProviderUnavailable(
      ProviderUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding provider unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(HttpStatus.SERVICE_UNAVAILABLE, ApiError.EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.", errorId, request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String code, String message, String errorId, HttpServletRequest request) {
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
