package com.flamingo.ai.memorybot.service.reminder;

import com.flamingo.ai.memorybot.domain.entity.AppUser;
import com.flamingo.ai.memorybot.domain.entity.Memory;
import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.ReminderStatus;
import com.flamingo.ai.memorybot.domain.repository.MemoryRepository;
import com.flamingo.ai.memorybot.domain.repository.ReminderRepository;
import com.flamingo.ai.memorybot.domain.repository.UserRepository;
import com.flamingo.ai.memorybot.exception.ApiError;
import com.flamingo.ai.memorybot.exception.MemoryNotFoundException;
import com.flamingo.ai.memorybot.exception.UserNotFoundException;
import com.flamingo.ai.memorybot.exception.ValidationException;
import com.flamingo.ai.memorybot.service.messaging.MessagingClient;
import com.flamingo.ai.memorybot.service.time.TimeExpressionParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of ReminderService backed by JPA and the messaging client. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderServiceImpl implements ReminderService {

  private final ReminderRepository reminderRepository;
  private final MemoryRepository memoryRepository;
  private final UserRepository userRepository;
  private final TimeExpressionParser timeExpressionParser;
  private final MessagingClient messagingClient;
  private final ReminderMessageFormatter messageFormatter;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Transactional
  public Reminder create(UUID ownerId, UUID memoryId, Instant when, String message) {
    if (message == null || message.isBlank()) {
      throw new ValidationException(ApiError.REMINDER_INVALID, "Reminder message is required");
    }
    if (when == null) {
      throw new ValidationException(ApiError.REMINDER_INVALID, "Reminder time is required");
    }
    if (!userRepository.existsById(ownerId)) {
      throw new UserNotFoundException(ownerId);
    }
    memoryRepository
        .findByIdAndUserId(memoryId, ownerId)
        .orElseThrow(() -> new MemoryNotFoundException(memoryId));

    Instant now = clock.instant();
    if (!when.isAfter(now)) {
      throw new ValidationException(
          ApiError.REMINDER_INVALID, "Reminder time must be in the future");
    }

    Reminder reminder =
        Reminder.builder()
            .ownerId(ownerId)
            .memoryId(memoryId)
            .scheduledFor(when)
            .message(message.trim())
            .status(ReminderStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
    Reminder saved = reminderRepository.save(reminder);

    meterRegistry.counter("reminder.created").increment();
    log.info("Created reminder {} for user {} at {}", saved.getId(), ownerId, when);
    return saved;
  }

  @Override
  @Transactional
  public Optional<Reminder> createFromPhrase(
      UUID ownerId, UUID memoryId, String phrase, String message, ZoneId zone) {

    ZoneId effectiveZone = zone != null ? zone : resolveZone(ownerId, null);
    Optional<Instant> when = timeExpressionParser.parse(phrase, effectiveZone, clock.instant());
    if (when.isEmpty()) {
      log.warn("Could not parse time phrase '{}' for user {}", phrase, ownerId);
      return Optional.empty();
    }
    return Optional.of(create(ownerId, memoryId, when.get(), message));
  }

  @Override
  public boolean cancel(UUID reminderId, UUID ownerId) {
    boolean cancelled =
        reminderRepository.cancelIfPending(reminderId, ownerId, clock.instant()) == 1;
    if (cancelled) {
      meterRegistry.counter("reminder.cancelled").increment();
      log.info("Cancelled reminder {} for user {}", reminderId, ownerId);
    } else {
      log.debug("Reminder {} not cancellable for user {}", reminderId, ownerId);
    }
    return cancelled;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Reminder> listReminders(UUID ownerId, ReminderStatus status) {
    if (status == null) {
      return reminderRepository.findByOwnerIdOrderByScheduledForAsc(ownerId);
    }
    return reminderRepository.findByOwnerIdAndStatusOrderByScheduledForAsc(ownerId, status);
  }

  @Override
  @Transactional(readOnly = true)
  public ReminderStats stats(UUID ownerId) {
    Instant now = clock.instant();
    ZoneId zone = ownerId != null ? resolveZone(ownerId, null) : ZoneOffset.UTC;
    Instant endOfDay = startOfNextDay(now, zone).toInstant();

    long total;
    long pending;
    long sent;
    long cancelled;
    long upcomingToday;
    if (ownerId == null) {
      total = reminderRepository.count();
      pending = reminderRepository.countByStatus(ReminderStatus.PENDING);
      sent = reminderRepository.countByStatus(ReminderStatus.SENT);
      cancelled = reminderRepository.countByStatus(ReminderStatus.CANCELLED);
      upcomingToday =
          reminderRepository.countByStatusAndScheduledForGreaterThanEqualAndScheduledForLessThan(
              ReminderStatus.PENDING, now, endOfDay);
    } else {
      total = reminderRepository.countByOwnerId(ownerId);
      pending = reminderRepository.countByOwnerIdAndStatus(ownerId, ReminderStatus.PENDING);
      sent = reminderRepository.countByOwnerIdAndStatus(ownerId, ReminderStatus.SENT);
      cancelled = reminderRepository.countByOwnerIdAndStatus(ownerId, ReminderStatus.CANCELLED);
      upcomingToday =
          reminderRepository
              .countByOwnerIdAndStatusAndScheduledForGreaterThanEqualAndScheduledForLessThan(
                  ownerId, ReminderStatus.PENDING, now, endOfDay);
    }

    return new ReminderStats(
        total, pending, sent, cancelled, upcomingToday, ReminderStats.successRate(sent, total));
  }

  @Override
  @Timed(value = "reminder.process", description = "Time to deliver one batch of due reminders")
  public DeliveryBatchResult processDueReminders() {
    List<Reminder> due = reminderRepository.findDue(clock.instant());
    if (due.isEmpty()) {
      return DeliveryBatchResult.empty();
    }

    log.info("Processing {} due reminders", due.size());
    int sent = 0;
    int failed = 0;
    for (Reminder reminder : due) {
      if (deliver(reminder)) {
        sent++;
      } else {
        failed++;
      }
    }
    log.info("Reminder batch done: {} sent, {} failed", sent, failed);
    return new DeliveryBatchResult(due.size(), sent, failed);
  }

  /** Sends one reminder and records the terminal status. Never throws. */
  private boolean deliver(Reminder reminder) {
    try {
      AppUser user =
          userRepository
              .findById(reminder.getOwnerId())
              .orElseThrow(() -> new UserNotFoundException(reminder.getOwnerId()));
      Memory memory = memoryRepository.findById(reminder.getMemoryId()).orElse(null);

      messagingClient.send(user.whatsappAddress(), messageFormatter.format(reminder, memory));
    } catch (RuntimeException e) {
      meterRegistry.counter("reminder.failed").increment();
      log.error("Failed to deliver reminder {}: {}", reminder.getId(), e.getMessage(), e);
      recordStatus(reminder, ReminderStatus.CANCELLED);
      return false;
    }

    meterRegistry.counter("reminder.sent").increment();
    log.info("Delivered reminder {} to user {}", reminder.getId(), reminder.getOwnerId());
    recordStatus(reminder, ReminderStatus.SENT);
    return true;
  }

  private void recordStatus(Reminder reminder, ReminderStatus target) {
    try {
      if (reminderRepository.transitionFromPending(reminder.getId(), target, clock.instant())
          == 0) {
        log.warn("Reminder {} left PENDING before it could be marked {}", reminder.getId(), target);
      }
    } catch (RuntimeException e) {
      log.error(
          "Failed to mark reminder {} {}: {}", reminder.getId(), target, e.getMessage(), e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public ZoneId resolveZone(UUID ownerId, String explicitZoneId) {
    String zoneId = explicitZoneId;
    if (zoneId == null || zoneId.isBlank()) {
      zoneId =
          ownerId == null
              ? null
              : userRepository.findById(ownerId).map(AppUser::getTimezone).orElse(null);
    }
    if (zoneId == null || zoneId.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(zoneId.trim());
    } catch (DateTimeException e) {
      throw new ValidationException("Unknown timezone: " + zoneId);
    }
  }

  static ZonedDateTime startOfNextDay(Instant now, ZoneId zone) {
    return now.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone);
  }
}
