package com.flamingo.ai.memorybot.service.reminder;

import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.ReminderStatus;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Service for the reminder lifecycle. */
public interface ReminderService {

  /**
   * Schedules a reminder for a memory the owner holds.
   *
   * @throws com.flamingo.ai.memorybot.exception.UserNotFoundException if the owner is unknown
   * @throws com.flamingo.ai.memorybot.exception.MemoryNotFoundException if the memory is missing
   *     or belongs to someone else
   * @throws com.flamingo.ai.memorybot.exception.ValidationException if {@code when} is not in the
   *     future or the message is blank
   */
  Reminder create(UUID ownerId, UUID memoryId, Instant when, String message);

  /**
   * Parses a time phrase and schedules a reminder at the resulting instant.
   *
   * @param zone zone used to read the phrase; the owner's stored zone when null
   * @return the reminder, or empty when the phrase was not understood (nothing is saved)
   */
  Optional<Reminder> createFromPhrase(
      UUID ownerId, UUID memoryId, String phrase, String message, ZoneId zone);

  /**
   * Cancels a pending reminder.
   *
   * @return true if this call cancelled it; false for unknown, foreign or finished reminders
   */
  boolean cancel(UUID reminderId, UUID ownerId);

  /** Reminders of one owner, earliest first, optionally filtered by status. */
  List<Reminder> listReminders(UUID ownerId, ReminderStatus status);

  /** Counts for one owner, or for everyone when {@code ownerId} is null. */
  ReminderStats stats(UUID ownerId);

  /**
   * Delivers every pending reminder that is due, earliest first and one at a time. Delivery
   * failures mark the reminder CANCELLED and never propagate.
   */
  DeliveryBatchResult processDueReminders();

  /**
   * Picks the zone for reading a user's phrases: the explicit id if given, else the user's stored
   * zone, else UTC.
   *
   * @throws com.flamingo.ai.memorybot.exception.ValidationException for an unknown zone id
   */
  ZoneId resolveZone(UUID ownerId, String explicitZoneId);
}
