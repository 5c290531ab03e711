package com.flamingo.ai.memorybot.service.time;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** Outcome of one matcher: either the instant the phrase denotes or no match. */
public final class MatchResult {

  private static final MatchResult NO_MATCH = new MatchResult(null);

  private final Instant instant;

  private MatchResult(Instant instant) {
    this.instant = instant;
  }

  public static MatchResult matched(Instant instant) {
    return new MatchResult(Objects.requireNonNull(instant, "instant"));
  }

  public static MatchResult noMatch() {
    return NO_MATCH;
  }

  public boolean isMatched() {
    return instant != null;
  }

  public Optional<Instant> instant() {
    return Optional.ofNullable(instant);
  }

  @Override
  public String toString() {
    return isMatched() ? "Matched[" + instant + "]" : "NoMatch";
  }
}
