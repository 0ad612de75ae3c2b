package com.hatch.integration.twilio;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RetryAfterParserTest {
  private final RetryAfterParser parser =
      new RetryAfterParser(Clock.fixed(Instant.parse("2026-03-02T09:15:00Z"), ZoneOffset.UTC));

  @Test
  void shouldParseDeltaSeconds() {
    assertEquals(Optional.of(Duration.ofSeconds(3)), parser.parse(" 3 "));
    assertEquals(Optional.of(Duration.ZERO), parser.parse("0"));
  }

  @Test
  void shouldParseHttpDateRelativeToClock() {
    assertEquals(
        Optional.of(Duration.ofSeconds(7)), parser.parse("Mon, 02 Mar 2026 09:15:07 GMT"));
    assertEquals(Optional.of(Duration.ZERO), parser.parse("Mon, 02 Mar 2026 09:14:00 GMT"));
  }

  @Test
  void shouldIgnoreUnparseableValues() {
    assertEquals(Optional.empty(), parser.parse(null));
    assertEquals(Optional.empty(), parser.parse(""));
    assertEquals(Optional.empty(), parser.parse("-5"));
    assertEquals(Optional.empty(), parser.parse("soon"));
  }
}
