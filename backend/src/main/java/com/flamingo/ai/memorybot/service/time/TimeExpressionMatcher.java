package com.flamingo.ai.memorybot.service.time;

import java.time.ZonedDateTime;

/** One recognizable shape of time phrase. */
public interface TimeExpressionMatcher {

  /**
   * Tries to interpret the phrase.
   *
   * @param phrase lowercased phrase with collapsed whitespace
   * @param now current instant in the user's zone
   */
  MatchResult match(String phrase, ZonedDateTime now);
}
