package com.flamingo.ai.memorybot.service.time;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "at 9am", "3:30 pm", "at 18:45". Today at that local time, or tomorrow when it has already
 * passed. A 24-hour time needs the "at" and the minutes so bare numbers are not read as times.
 */
public class ClockTimeTodayMatcher implements TimeExpressionMatcher {

  private static final Pattern TWELVE_HOUR =
      Pattern.compile("(?:\\bat )?\\b(\\d{1,2})(?::(\\d{2}))?\\s*([ap]m)\\b");
  private static final Pattern TWENTY_FOUR_HOUR = Pattern.compile("\\bat (\\d{1,2}):(\\d{2})\\b");

  @Override
  public MatchResult match(String phrase, ZonedDateTime now) {
    Optional<LocalTime> time = Optional.empty();

    Matcher m = TWELVE_HOUR.matcher(phrase);
    if (m.find()) {
      time = ClockTimes.toLocalTime(m.group(1), m.group(2), m.group(3));
    } else {
      Matcher h24 = TWENTY_FOUR_HOUR.matcher(phrase);
      if (h24.find()) {
        time = ClockTimes.toLocalTime(h24.group(1), h24.group(2), null);
      }
    }
    if (time.isEmpty()) {
      return MatchResult.noMatch();
    }

    ZonedDateTime target = ZonedDateTime.of(now.toLocalDate(), time.get(), now.getZone());
    if (!target.isAfter(now)) {
      target = ZonedDateTime.of(now.toLocalDate().plusDays(1), time.get(), now.getZone());
    }
    return MatchResult.matched(target.toInstant());
  }
}
