package com.flamingo.ai.memorybot.api.rest;

import com.flamingo.ai.memorybot.api.dto.request.CreateReminderRequest;
import com.flamingo.ai.memorybot.api.dto.response.ReminderResponse;
import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.ReminderStatus;
import com.flamingo.ai.memorybot.exception.ApiError;
import com.flamingo.ai.memorybot.exception.ValidationException;
import com.flamingo.ai.memorybot.service.reminder.DeliveryBatchResult;
import com.flamingo.ai.memorybot.service.reminder.ReminderPollLoop;
import com.flamingo.ai.memorybot.service.reminder.ReminderService;
import com.flamingo.ai.memorybot.service.reminder.ReminderStats;
import jakarta.validation.Valid;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for scheduling and managing reminders. */
@RestController
@RequestMapping("/api/reminders")
@RequiredArgsConstructor
@Slf4j
public class ReminderController {

  private final ReminderService reminderService;
  private final ReminderPollLoop reminderPollLoop;

  /**
   * Schedules a reminder at an absolute instant or from a time phrase.
   *
   * @param request the reminder request
   * @return the created reminder
   */
  @PostMapping
  public ResponseEntity<ReminderResponse> createReminder(
      @Valid @RequestBody CreateReminderRequest request) {

    Reminder reminder;
    if (request.getScheduledFor() != null) {
      reminder =
          reminderService.create(
              request.getUserId(),
              request.getMemoryId(),
              request.getScheduledFor(),
              request.getMessage());
    } else {
      ZoneId zone = reminderService.resolveZone(request.getUserId(), request.getTimezone());
      log.info(
          "Creating reminder from phrase '{}' for user {} in {}",
          request.getNaturalLanguageTime(),
          request.getUserId(),
          zone);
      reminder =
          reminderService
              .createFromPhrase(
                  request.getUserId(),
                  request.getMemoryId(),
                  request.getNaturalLanguageTime(),
                  request.getMessage(),
                  zone)
              .orElseThrow(
                  () ->
                      new ValidationException(
                          ApiError.REMINDER_UNPARSABLE_TIME,
                          "Could not understand the time '"
                              + request.getNaturalLanguageTime()
                              + "'. Try 'in 2 hours', 'tomorrow at 3pm' or 'next week'."));
    }

    return ResponseEntity.status(HttpStatus.CREATED).body(ReminderResponse.fromEntity(reminder));
  }

  /**
   * Lists a user's reminders, earliest first.
   *
   * @param userId the owner
   * @param status optional status filter
   */
  @GetMapping
  public ResponseEntity<List<ReminderResponse>> listReminders(
      @RequestParam UUID userId, @RequestParam(required = false) ReminderStatus status) {
    List<ReminderResponse> response =
        reminderService.listReminders(userId, status).stream()
            .map(ReminderResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(response);
  }

  /** Cancels a pending reminder. Cancelling a finished or foreign reminder is a no-op. */
  @DeleteMapping("/{reminderId}")
  public ResponseEntity<Map<String, Object>> cancelReminder(
      @PathVariable UUID reminderId, @RequestParam UUID userId) {
    boolean cancelled = reminderService.cancel(reminderId, userId);
    Map<String, Object> body = new HashMap<>();
    body.put("reminderId", reminderId);
    body.put("cancelled", cancelled);
    return ResponseEntity.ok(body);
  }

  @GetMapping("/stats")
  public ResponseEntity<ReminderStats> stats(@RequestParam(required = false) UUID userId) {
    return ResponseEntity.ok(reminderService.stats(userId));
  }

  /** Runs one delivery pass now, unless one is already running. */
  @PostMapping("/process")
  public ResponseEntity<Map<String, Object>> processDueReminders() {
    Optional<DeliveryBatchResult> result = reminderPollLoop.tick();
    Map<String, Object> body = new HashMap<>();
    body.put("skipped", result.isEmpty());
    result.ifPresent(
        r -> {
          body.put("due", r.due());
          body.put("sent", r.sent());
          body.put("failed", r.failed());
        });
    return ResponseEntity.ok(body);
  }
}
