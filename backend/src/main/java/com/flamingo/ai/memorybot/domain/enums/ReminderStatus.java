package com.flamingo.ai.memorybot.domain.enums;

/**
 * Lifecycle of a scheduled reminder. The only legal transitions are {@code PENDING -> SENT} and
 * {@code PENDING -> CANCELLED}.
 */
public enum ReminderStatus {
  /** Waiting for its scheduled instant. */
  PENDING,

  /** Delivered to the owner. Terminal. */
  SENT,

  /** Cancelled by the owner, or dropped after a failed delivery. Terminal. */
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
