package com.flamingo.ai.memorybot.service.reminder;

/** Outcome of one pass over the due reminders. */
public record DeliveryBatchResult(int due, int sent, int failed) {

  public static DeliveryBatchResult empty() {
    return new DeliveryBatchResult(0, 0, 0);
  }
}
