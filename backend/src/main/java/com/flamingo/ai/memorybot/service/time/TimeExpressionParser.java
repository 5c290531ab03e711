package com.flamingo.ai.memorybot.service.time;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns phrases such as "in 2 hours", "tomorrow at 3 PM" or "at 9am" into UTC instants.
 *
 * <p>Matchers are tried in order and the first match wins. All calendar arithmetic happens in the
 * user's zone. The parser does no I/O and reads no clock, so the same inputs always give the same
 * answer.
 */
@Component
@Slf4j
public class TimeExpressionParser {

  private final List<TimeExpressionMatcher> matchers;

  @Autowired
  public TimeExpressionParser(MemoryBotConfig config) {
    this(defaultMatchers(LocalTime.of(config.getReminders().getDefaultHour(), 0)));
  }

  public TimeExpressionParser(List<TimeExpressionMatcher> matchers) {
    this.matchers = List.copyOf(matchers);
  }

  /** Built-in matchers in evaluation order. */
  public static List<TimeExpressionMatcher> defaultMatchers(LocalTime defaultTime) {
    return List.of(
        new RelativeOffsetMatcher(),
        new RelativeDayMatcher(defaultTime),
        new NextWeekMatcher(defaultTime),
        new ClockTimeTodayMatcher());
  }

  /**
   * Parses a time phrase.
   *
   * @param phrase free text from the user
   * @param zone the user's zone
   * @param now current instant
   * @return the instant the phrase denotes, or empty when nothing recognizes it
   */
  public Optional<Instant> parse(String phrase, ZoneId zone, Instant now) {
    if (phrase == null || phrase.isBlank()) {
      return Optional.empty();
    }

    String normalized = normalize(phrase);
    ZonedDateTime localNow = now.atZone(zone);
    for (TimeExpressionMatcher matcher : matchers) {
      MatchResult result = matcher.match(normalized, localNow);
      if (result.isMatched()) {
        log.debug(
            "Parsed '{}' with {} -> {}", phrase, matcher.getClass().getSimpleName(), result);
        return result.instant();
      }
    }
    log.debug("No time expression recognized in '{}'", phrase);
    return Optional.empty();
  }

  static String normalize(String phrase) {
    return phrase
        .toLowerCase(Locale.ROOT)
        .replaceAll("(?<=\\d|\\s)([ap])\\.m\\.?", "$1m")
        .replace(',', ' ')
        .replaceAll("\\s+", " ")
        .trim();
  }
}
