package com.flamingo.ai.memorybot.service.reminder;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Recurring scan for due reminders.
 *
 * <p>Started with the application context and stopped on graceful shutdown. A tick that finds
 * the previous one still running is skipped, so two batches never deliver concurrently. Manual
 * triggers go through {@link #tick()} and share the same guard.
 */
@Component
@Slf4j
public class ReminderPollLoop implements SmartLifecycle {

  private final ReminderService reminderService;
  private final TaskScheduler taskScheduler;
  private final MemoryBotConfig.Reminders settings;
  private final MeterRegistry meterRegistry;

  private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
  private volatile boolean running;
  private ScheduledFuture<?> scheduledTask;

  public ReminderPollLoop(
      ReminderService reminderService,
      @Qualifier("reminderTaskScheduler") TaskScheduler taskScheduler,
      MemoryBotConfig config,
      MeterRegistry meterRegistry) {
    this.reminderService = reminderService;
    this.taskScheduler = taskScheduler;
    this.settings = config.getReminders();
    this.meterRegistry = meterRegistry;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (!settings.isSchedulerEnabled()) {
      log.info("Reminder poll loop disabled by configuration");
      return;
    }
    running = true;
    scheduledTask =
        taskScheduler.scheduleAtFixedRate(
            this::scheduledTick, Duration.ofMillis(settings.getPollIntervalMs()));
    log.info("Reminder poll loop started, interval={}ms", settings.getPollIntervalMs());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (scheduledTask != null) {
      // An in-flight tick finishes its current batch
      scheduledTask.cancel(false);
      scheduledTask = null;
    }
    log.info("Reminder poll loop stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Whether a batch is being delivered right now. */
  public boolean isTickInProgress() {
    return tickInProgress.get();
  }

  /**
   * Runs one delivery pass unless another is in progress.
   *
   * @return the batch outcome, or empty when the pass was skipped
   */
  public Optional<DeliveryBatchResult> tick() {
    if (!tickInProgress.compareAndSet(false, true)) {
      meterRegistry.counter("reminder.poll.skipped").increment();
      log.debug("Previous reminder pass still running, skipping");
      return Optional.empty();
    }
    try {
      return Optional.of(reminderService.processDueReminders());
    } finally {
      tickInProgress.set(false);
    }
  }

  void scheduledTick() {
    if (!running) {
      return;
    }
    try {
      tick();
    } catch (RuntimeException e) {
      // Keep the schedule alive; the next tick retries the query
      log.error("Reminder poll tick failed: {}", e.getMessage(), e);
    }
  }
}
