package com.flamingo.ai.memorybot.exception;

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
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> handleDomainValidation(
      ValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Rejected input [{}]: {}", errorId, ex.getMessage());

    return respond(HttpStatus.BAD_REQUEST, errorId, ex.getCode(), ex.getMessage(), request);
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiError> handleUserNotFound(
      UserNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("user_not_found");
    String errorId = generateErrorId();
    log.warn("User not found [{}]: {}", errorId, ex.getUserId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.USER_NOT_FOUND, "User not found", request);
  }

  @ExceptionHandler(MemoryNotFoundException.class)
  public ResponseEntity<ApiError> handleMemoryNotFound(
      MemoryNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("memory_not_found");
    String errorId = generateErrorId();
    log.warn("Memory not found [{}]: {}", errorId, ex.getMemoryId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.MEMORY_NOT_FOUND, "Memory not found", request);
  }

  @ExceptionHandler(BlobNotFoundException.class)
  public ResponseEntity<ApiError> handleBlobNotFound(
      BlobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("media_not_found");
    String errorId = generateErrorId();
    log.warn("Blob not found [{}]: {}", errorId, ex.getFingerprint());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.MEDIA_NOT_FOUND, "Media not found", request);
  }

  @ExceptionHandler(MediaFetchException.class)
  public ResponseEntity<ApiError> handleMediaFetch(
      MediaFetchException ex, HttpServletRequest request) {

    incrementErrorCounter("media_fetch_error");
    String errorId = generateErrorId();
    log.warn("Media fetch failed [{}]: {} ({})", errorId, ex.getMessage(), ex.getSourceUrl());

    return respond(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.MEDIA_FETCH_FAILED, ex.getUserMessage(), request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {

    incrementErrorCounter("storage_error");
    String errorId = generateErrorId();
    log.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.MEDIA_STORAGE_ERROR,
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

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message = "Invalid value for " + ex.getName() + ": " + ex.getValue();
    log.warn("Type mismatch [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParameter(
      MissingServletRequestParameterException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message = "Missing required parameter: " + ex.getParameterName();
    log.warn("Missing parameter [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is malformed or has invalid values",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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
