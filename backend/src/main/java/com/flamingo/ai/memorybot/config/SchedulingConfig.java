package com.flamingo.ai.memorybot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Configuration for the reminder poll timer. */
@Configuration
public class SchedulingConfig {

  /**
   * Single-threaded scheduler backing the reminder poll loop. Due reminders are delivered one at
   * a time, so one thread is all the loop ever uses.
   */
  @Bean(name = "reminderTaskScheduler")
  public ThreadPoolTaskScheduler reminderTaskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("reminder-poll-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    scheduler.initialize();
    return scheduler;
  }
}
