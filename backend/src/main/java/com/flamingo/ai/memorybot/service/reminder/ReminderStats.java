package com.flamingo.ai.memorybot.service.reminder;

/**
 * Reminder counts for one user or the whole system.
 *
 * @param upcomingToday pending reminders due between now and the end of the current local day
 * @param successRate sent divided by total, 0 when there are no reminders
 */
public record ReminderStats(
    long total,
    long pending,
    long sent,
    long cancelled,
    long upcomingToday,
    double successRate) {

  static double successRate(long sent, long total) {
    return total == 0 ? 0.0 : (double) sent / total;
  }
}
