package com.flamingo.ai.memorybot.exception;

/** Exception thrown when no blob exists for a fingerprint. */
public class BlobNotFoundException extends RuntimeException {

  private final String fingerprint;

  public BlobNotFoundException(String fingerprint) {
    super("Blob not found with fingerprint: " + fingerprint);
    this.fingerprint = fingerprint;
  }

  public String getFingerprint() {
    return fingerprint;
  }
}
