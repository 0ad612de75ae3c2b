package com.hatch.integration.twilio;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/** Reads a {@code Retry-After} value given either as delta seconds or as an HTTP date. */
public class RetryAfterParser {
  private final Clock clock;

  public RetryAfterParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Optional<Duration> parse(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return Optional.empty();
    }
    String candidate = headerValue.trim();
    if (candidate.chars().allMatch(Character::isDigit)) {
      try {
        return Optional.of(Duration.ofSeconds(Long.parseLong(candidate)));
      } catch (NumberFormatException tooLarge) {
        return Optional.empty();
      }
    }
    try {
      ZonedDateTime retryAt = ZonedDateTime.parse(candidate, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration remaining = Duration.between(clock.instant(), retryAt.toInstant());
      return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    } catch (DateTimeParseException ignored) {
      return Optional.empty();
    }
  }
}
