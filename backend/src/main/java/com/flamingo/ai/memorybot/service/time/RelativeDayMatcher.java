package com.flamingo.ai.memorybot.service.time;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** "tomorrow", "tomorrow at 3 pm", "tomorrow at 15:30". */
public class RelativeDayMatcher implements TimeExpressionMatcher {

  private static final Pattern TOMORROW = Pattern.compile("\\btomorrow\\b");
  private static final Pattern AT_TIME = Pattern.compile("\\bat " + ClockTimes.CLOCK_PATTERN);

  private final LocalTime defaultTime;

  public RelativeDayMatcher(LocalTime defaultTime) {
    this.defaultTime = defaultTime;
  }

  @Override
  public MatchResult match(String phrase, ZonedDateTime now) {
    if (!TOMORROW.matcher(phrase).find()) {
      return MatchResult.noMatch();
    }

    LocalTime time = defaultTime;
    Matcher m = AT_TIME.matcher(phrase);
    if (m.find()) {
      Optional<LocalTime> parsed = ClockTimes.toLocalTime(m.group(1), m.group(2), m.group(3));
      if (parsed.isEmpty()) {
        return MatchResult.noMatch();
      }
      time = parsed.get();
    }

    ZonedDateTime target = ZonedDateTime.of(now.toLocalDate().plusDays(1), time, now.getZone());
    return MatchResult.matched(target.toInstant());
  }
}
