package com.hatch.integration.twilio;

import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.http.HttpHeaders;

public record CarrierResponseHeaders(
    String requestId,
    Integer concurrentRequests,
    BigDecimal requestDurationSeconds,
    Instant responseDate,
    String homeRegion) {
  static final String REQUEST_ID = "Twilio-Request-Id";
  static final String CONCURRENT_REQUESTS = "Twilio-Concurrent-Requests";
  static final String REQUEST_DURATION = "Twilio-Request-Duration";
  static final String HOME_REGION = "X-Home-Region";

  public static CarrierResponseHeaders empty() {
    return new CarrierResponseHeaders(null, null, null, null, null);
  }

  public static CarrierResponseHeaders from(HttpHeaders headers) {
    if (headers == null || headers.isEmpty()) {
      return empty();
    }
    return new CarrierResponseHeaders(
        headers.getFirst(REQUEST_ID),
        parseInteger(headers.getFirst(CONCURRENT_REQUESTS)),
        parseDecimal(headers.getFirst(REQUEST_DURATION)),
        parseDate(headers),
        headers.getFirst(HOME_REGION));
  }

  private static Integer parseInteger(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static BigDecimal parseDecimal(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static Instant parseDate(HttpHeaders headers) {
    try {
      long epochMillis = headers.getDate();
      return epochMillis < 0 ? null : Instant.ofEpochMilli(epochMillis);
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }
}
