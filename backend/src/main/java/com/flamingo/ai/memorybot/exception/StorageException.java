package com.flamingo.ai.memorybot.exception;

/** Thrown when blob bytes cannot be written to or read from storage. */
public class StorageException extends RuntimeException {

  private final String fingerprint;

  public StorageException(String fingerprint, String message, Throwable cause) {
    super(message, cause);
    this.fingerprint = fingerprint;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public String getUserMessage() {
    return "Failed to store media";
  }
}
