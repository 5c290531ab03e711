package com.flamingo.ai.memorybot.exception;

/** Thrown when caller input is rejected before any state changes. */
public class ValidationException extends RuntimeException {

  private final String code;

  public ValidationException(String message) {
    this(ApiError.VALIDATION_ERROR, message);
  }

  public ValidationException(String code, String message) {
    super(message);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
