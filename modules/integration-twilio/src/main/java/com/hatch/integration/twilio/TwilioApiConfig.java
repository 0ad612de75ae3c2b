package com.hatch.integration.twilio;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

public record TwilioApiConfig(
    URI baseUri, String accountSid, String authToken, Duration timeout, Clock clock) {
  public TwilioApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (accountSid == null || accountSid.isBlank()) {
      throw new IllegalArgumentException("accountSid is required");
    }
    if (authToken == null || authToken.isBlank()) {
      throw new IllegalArgumentException("authToken is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
  }

  @Override
  public String toString() {
    return "TwilioApiConfig[baseUri=" + baseUri + ", accountSid=" + accountSid + ", timeout="
        + timeout + "]";
  }
}
