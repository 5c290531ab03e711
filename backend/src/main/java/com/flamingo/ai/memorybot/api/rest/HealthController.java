package com.flamingo.ai.memorybot.api.rest;

import com.flamingo.ai.memorybot.service.media.FingerprintStore;
import com.flamingo.ai.memorybot.service.reminder.ReminderPollLoop;
import com.flamingo.ai.memorybot.service.reminder.ReminderService;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ReminderPollLoop reminderPollLoop;
  private final FingerprintStore fingerprintStore;
  private final ReminderService reminderService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "memorybot");
    health.put("reminderSchedulerRunning", reminderPollLoop.isRunning());
    health.put("reminderBatchInProgress", reminderPollLoop.isTickInProgress());
    return ResponseEntity.ok(health);
  }

  /** Returns media and reminder statistics. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("media", fingerprintStore.stats());
    stats.put("reminders", reminderService.stats(null));
    stats.put("timestamp", Instant.now());
    return ResponseEntity.ok(stats);
  }
}
