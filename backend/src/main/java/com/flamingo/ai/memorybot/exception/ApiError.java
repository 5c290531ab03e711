package com.flamingo.ai.memorybot.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String USER_NOT_FOUND = "USER_001";
  public static final String MEMORY_NOT_FOUND = "MEMORY_001";
  public static final String MEDIA_FETCH_FAILED = "MEDIA_001";
  public static final String MEDIA_STORAGE_ERROR = "MEDIA_002";
  public static final String MEDIA_NOT_FOUND = "MEDIA_003";
  public static final String REMINDER_INVALID = "REMINDER_001";
  public static final String REMINDER_UNPARSABLE_TIME = "REMINDER_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
