package com.flamingo.ai.memorybot.exception;

/**
 * Thrown when remote media cannot be retrieved or its indirection cannot be resolved. Nothing is
 * persisted when this is thrown, so the whole ingest may be retried.
 */
public class MediaFetchException extends RuntimeException {

  private final String sourceUrl;
  private final String userMessage;

  public MediaFetchException(String sourceUrl, String message) {
    super(message);
    this.sourceUrl = sourceUrl;
    this.userMessage = "Could not download the media. Please try again.";
  }

  public MediaFetchException(String sourceUrl, String message, Throwable cause) {
    super(message, cause);
    this.sourceUrl = sourceUrl;
    this.userMessage = "Could not download the media. Please try again.";
  }

  public String getSourceUrl() {
    return sourceUrl;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
