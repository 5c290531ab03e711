package com.flamingo.ai.memorybot.service.time;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** "in 2 hours", "in 45 minutes". */
public class RelativeOffsetMatcher implements TimeExpressionMatcher {

  private static final Pattern PATTERN =
      Pattern.compile("\\bin (\\d{1,5}) (hours?|hrs?|minutes?|mins?)\\b");

  @Override
  public MatchResult match(String phrase, ZonedDateTime now) {
    Matcher m = PATTERN.matcher(phrase);
    if (!m.find()) {
      return MatchResult.noMatch();
    }
    long amount = Long.parseLong(m.group(1));
    if (amount == 0) {
      return MatchResult.noMatch();
    }
    Duration offset =
        m.group(2).startsWith("h") ? Duration.ofHours(amount) : Duration.ofMinutes(amount);
    return MatchResult.matched(now.toInstant().plus(offset));
  }
}
