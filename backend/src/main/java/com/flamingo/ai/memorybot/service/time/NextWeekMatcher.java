package com.flamingo.ai.memorybot.service.time;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/** "next week": seven local days ahead at the default time. */
public class NextWeekMatcher implements TimeExpressionMatcher {

  private static final Pattern PATTERN = Pattern.compile("\\bnext week\\b");

  private final LocalTime defaultTime;

  public NextWeekMatcher(LocalTime defaultTime) {
    this.defaultTime = defaultTime;
  }

  @Override
  public MatchResult match(String phrase, ZonedDateTime now) {
    if (!PATTERN.matcher(phrase).find()) {
      return MatchResult.noMatch();
    }
    ZonedDateTime target =
        ZonedDateTime.of(now.toLocalDate().plusWeeks(1), defaultTime, now.getZone());
    return MatchResult.matched(target.toInstant());
  }
}
