package com.flamingo.ai.memorybot.exception;

import java.util.UUID;

/** Exception thrown when a memory is missing or not owned by the caller. */
public class MemoryNotFoundException extends RuntimeException {

  private final UUID memoryId;

  public MemoryNotFoundException(UUID memoryId) {
    super("Memory not found with ID: " + memoryId);
    this.memoryId = memoryId;
  }

  public UUID getMemoryId() {
    return memoryId;
  }
}
