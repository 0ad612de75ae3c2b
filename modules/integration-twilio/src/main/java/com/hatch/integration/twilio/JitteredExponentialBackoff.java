package com.hatch.integration.twilio;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay before the next carrier call. The ceiling for retry {@code n} is {@code base * 2^n}, never
 * above the cap; with jitter on, the delay is drawn uniformly from {@code [0, ceiling]}.
 */
public class JitteredExponentialBackoff {
  private final Duration base;
  private final Duration cap;
  private final boolean jitterEnabled;
  private final DoubleSupplier random;

  public JitteredExponentialBackoff(long baseBackoffMs, long maxBackoffMs, boolean jitterEnabled) {
    this(baseBackoffMs, maxBackoffMs, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      long baseBackoffMs, long maxBackoffMs, boolean jitterEnabled, DoubleSupplier random) {
    if (baseBackoffMs < 0L || maxBackoffMs < 0L) {
      throw new IllegalArgumentException("backoff bounds must not be negative");
    }
    this.base = Duration.ofMillis(baseBackoffMs);
    this.cap = Duration.ofMillis(Math.max(baseBackoffMs, maxBackoffMs));
    this.jitterEnabled = jitterEnabled;
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  public Duration backoffForAttempt(int attempt) {
    long ceilingMs = ceilingMs(Math.max(0, attempt));
    if (!jitterEnabled || ceilingMs == 0L) {
      return Duration.ofMillis(ceilingMs);
    }
    double sample = Math.min(Math.max(random.getAsDouble(), 0.0d), Math.nextDown(1.0d));
    return Duration.ofMillis((long) (sample * (ceilingMs + 1L)));
  }

  public Duration maxBackoff() {
    return cap;
  }

  private long ceilingMs(int exponent) {
    long baseMs = base.toMillis();
    long capMs = cap.toMillis();
    if (baseMs == 0L) {
      return 0L;
    }
    // Shifting past the sign bit would overflow; the cap applies long before that.
    if (exponent >= Long.numberOfLeadingZeros(baseMs) - 1) {
      return capMs;
    }
    return Math.min(capMs, baseMs << exponent);
  }
}
