package com.flamingo.ai.memorybot.service.time;

import java.time.LocalTime;
import java.util.Optional;

/** Conversion of "3", "3:30 pm", "15:45" style clock times. */
final class ClockTimes {

  /** Hour, optional minutes and optional am/pm marker as regex groups. */
  static final String CLOCK_PATTERN = "(\\d{1,2})(?::(\\d{2}))?(?:\\s*([ap]m))?\\b";

  private ClockTimes() {}

  /**
   * Builds a local time from matched groups. With am/pm the hour must be 1 to 12; without it the
   * hour is read on a 24-hour clock.
   */
  static Optional<LocalTime> toLocalTime(String hourText, String minuteText, String period) {
    int hour = Integer.parseInt(hourText);
    int minute = minuteText == null ? 0 : Integer.parseInt(minuteText);
    if (minute > 59) {
      return Optional.empty();
    }

    if (period == null) {
      return hour > 23 ? Optional.empty() : Optional.of(LocalTime.of(hour, minute));
    }

    if (hour < 1 || hour > 12) {
      return Optional.empty();
    }
    if (period.equals("am")) {
      hour = hour == 12 ? 0 : hour;
    } else {
      hour = hour == 12 ? 12 : hour + 12;
    }
    return Optional.of(LocalTime.of(hour, minute));
  }
}
