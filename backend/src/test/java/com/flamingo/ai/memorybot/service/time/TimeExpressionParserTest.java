package com.flamingo.ai.memorybot.service.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TimeExpressionParserTest {

  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  private TimeExpressionParser parser;

  @BeforeEach
  void setUp() {
    parser = new TimeExpressionParser(TimeExpressionParser.defaultMatchers(LocalTime.of(9, 0)));
  }

  private static Instant newYork(int year, int month, int day, int hour, int minute) {
    return LocalDateTime.of(year, month, day, hour, minute).atZone(NEW_YORK).toInstant();
  }

  @Nested
  @DisplayName("relative offsets")
  class RelativeOffsets {

    @Test
    @DisplayName("should add hours to now")
    void shouldAddHours() {
      Instant now = Instant.parse("2024-01-15T15:00:00Z");

      assertThat(parser.parse("in 2 hours", NEW_YORK, now))
          .contains(now.plus(Duration.ofHours(2)));
    }

    @Test
    @DisplayName("should add minutes inside a longer sentence")
    void shouldAddMinutesInsideSentence() {
      Instant now = Instant.parse("2024-01-15T15:00:00Z");

      assertThat(parser.parse("Remind me in 45 minutes please", ZoneOffset.UTC, now))
          .contains(now.plus(Duration.ofMinutes(45)));
    }

    @Test
    @DisplayName("should accept singular units")
    void shouldAcceptSingularUnit() {
      Instant now = Instant.parse("2024-01-15T15:00:00Z");

      assertThat(parser.parse("in 1 hour", ZoneOffset.UTC, now))
          .contains(Instant.parse("2024-01-15T16:00:00Z"));
    }
  }

  @Nested
  @DisplayName("tomorrow")
  class Tomorrow {

    @Test
    @DisplayName("should resolve clock time in the user's zone and return UTC")
    void shouldResolveClockTimeInUserZone() {
      Instant now = newYork(2024, 1, 15, 10, 0);

      Optional<Instant> result = parser.parse("tomorrow at 3 PM", NEW_YORK, now);

      assertThat(result).contains(Instant.parse("2024-01-16T20:00:00Z"));
    }

    @Test
    @DisplayName("should default to 09:00 local without a clock time")
    void shouldDefaultToNineLocal() {
      Instant now = newYork(2024, 1, 15, 22, 30);

      assertThat(parser.parse("remind me tomorrow", NEW_YORK, now))
          .contains(newYork(2024, 1, 16, 9, 0));
    }

    @Test
    @DisplayName("should read minutes and 24-hour times")
    void shouldReadMinutesAnd24Hour() {
      Instant now = newYork(2024, 1, 15, 10, 0);

      assertThat(parser.parse("tomorrow at 7:45 am", NEW_YORK, now))
          .contains(newYork(2024, 1, 16, 7, 45));
      assertThat(parser.parse("tomorrow at 18:15", NEW_YORK, now))
          .contains(newYork(2024, 1, 16, 18, 15));
    }

    @Test
    @DisplayName("should map 12 am to midnight and 12 pm to noon")
    void shouldHandleTwelveOClock() {
      Instant now = newYork(2024, 1, 15, 10, 0);

      assertThat(parser.parse("tomorrow at 12am", NEW_YORK, now))
          .contains(newYork(2024, 1, 16, 0, 0));
      assertThat(parser.parse("tomorrow at 12pm", NEW_YORK, now))
          .contains(newYork(2024, 1, 16, 12, 0));
    }

    @Test
    @DisplayName("should shift a time skipped by a DST gap forward")
    void shouldShiftTimeInDstGap() {
      Instant now = newYork(2024, 3, 9, 12, 0);

      // 02:30 does not exist on 2024-03-10 in New York; clocks jump to 03:30 EDT
      assertThat(parser.parse("tomorrow at 2:30 am", NEW_YORK, now))
          .contains(Instant.parse("2024-03-10T07:30:00Z"));
    }

    @Test
    @DisplayName("should reject an impossible clock time")
    void shouldRejectImpossibleTime() {
      Instant now = newYork(2024, 1, 15, 10, 0);

      assertThat(parser.parse("tomorrow at 13pm", NEW_YORK, now)).isEmpty();
    }
  }

  @Nested
  @DisplayName("next week")
  class NextWeek {

    @Test
    @DisplayName("should be seven local days ahead at 09:00")
    void shouldBeSevenDaysAheadAtNine() {
      Instant now = newYork(2024, 1, 15, 16, 20);

      assertThat(parser.parse("next week", NEW_YORK, now)).contains(newYork(2024, 1, 22, 9, 0));
    }

    @Test
    @DisplayName("should keep local 09:00 across a DST change")
    void shouldKeepLocalTimeAcrossDst() {
      Instant now = newYork(2024, 3, 5, 12, 0);

      Instant result = parser.parse("next week", NEW_YORK, now).orElseThrow();

      assertThat(result.atZone(NEW_YORK).toLocalDateTime())
          .isEqualTo(LocalDateTime.of(2024, 3, 12, 9, 0));
      assertThat(result).isEqualTo(Instant.parse("2024-03-12T13:00:00Z"));
    }
  }

  @Nested
  @DisplayName("clock time today")
  class ClockTimeToday {

    @Test
    @DisplayName("should roll to tomorrow when the time has passed")
    void shouldRollWhenPassed() {
      Instant now = newYork(2024, 1, 15, 14, 0);

      assertThat(parser.parse("at 9am", NEW_YORK, now))
          .contains(Instant.parse("2024-01-16T14:00:00Z"));
    }

    @Test
    @DisplayName("should stay today when the time is still ahead")
    void shouldStayTodayWhenAhead() {
      Instant now = newYork(2024, 1, 15, 14, 0);

      assertThat(parser.parse("at 5:30 pm", NEW_YORK, now))
          .contains(newYork(2024, 1, 15, 17, 30));
    }

    @Test
    @DisplayName("should roll when the time equals now")
    void shouldRollWhenEqualToNow() {
      Instant now = newYork(2024, 1, 15, 14, 0);

      assertThat(parser.parse("at 2pm", NEW_YORK, now)).contains(newYork(2024, 1, 16, 14, 0));
    }

    @Test
    @DisplayName("should read dotted meridiem markers and 24-hour times")
    void shouldReadVariants() {
      Instant now = newYork(2024, 1, 15, 8, 0);

      assertThat(parser.parse("at 11 a.m.", NEW_YORK, now)).contains(newYork(2024, 1, 15, 11, 0));
      assertThat(parser.parse("at 20:05", NEW_YORK, now)).contains(newYork(2024, 1, 15, 20, 5));
    }

    @Test
    @DisplayName("should not treat a bare number as a time")
    void shouldIgnoreBareNumber() {
      Instant now = newYork(2024, 1, 15, 8, 0);

      assertThat(parser.parse("buy 3 apples", NEW_YORK, now)).isEmpty();
    }
  }

  @Nested
  @DisplayName("unrecognized phrases")
  class Unrecognized {

    @Test
    @DisplayName("should return empty for gibberish")
    void shouldReturnEmptyForGibberish() {
      assertThat(parser.parse("gibberish not a time", NEW_YORK, Instant.now())).isEmpty();
    }

    @Test
    @DisplayName("should return empty for blank input")
    void shouldReturnEmptyForBlank() {
      assertThat(parser.parse("   ", NEW_YORK, Instant.now())).isEmpty();
      assertThat(parser.parse(null, NEW_YORK, Instant.now())).isEmpty();
    }
  }

  @Nested
  @DisplayName("matcher ordering")
  class Ordering {

    @Test
    @DisplayName("should return the first matching strategy's result")
    void shouldPreferFirstMatch() {
      Instant fixed = Instant.parse("2030-01-01T00:00:00Z");
      TimeExpressionMatcher always = (phrase, now) -> MatchResult.matched(fixed);
      TimeExpressionMatcher never = (phrase, now) -> MatchResult.noMatch();
      TimeExpressionParser custom =
          new TimeExpressionParser(List.of(never, always, new RelativeOffsetMatcher()));

      assertThat(custom.parse("in 2 hours", ZoneOffset.UTC, Instant.EPOCH)).contains(fixed);
    }

    @Test
    @DisplayName("should be deterministic for identical inputs")
    void shouldBeDeterministic() {
      Instant now = ZonedDateTime.of(2024, 6, 1, 12, 0, 0, 0, NEW_YORK).toInstant();

      assertThat(parser.parse("tomorrow at 8pm", NEW_YORK, now))
          .isEqualTo(parser.parse("tomorrow at 8pm", NEW_YORK, now));
    }
  }
}
