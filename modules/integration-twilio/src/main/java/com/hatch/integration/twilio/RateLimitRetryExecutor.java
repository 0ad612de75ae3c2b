package com.hatch.integration.twilio;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-runs an operation while the carrier answers with a rate limit and the caller's budget allows
 * another try. Every other failure propagates on the first occurrence.
 */
public class RateLimitRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RateLimitRetryExecutor.class);

  private static final String RETRY_COUNTER = "connector.twilio.rate_limit.retry";
  private static final String EXHAUSTED_COUNTER = "connector.twilio.rate_limit.exhausted";

  private final RetryAfterParser retryAfterParser;
  private final JitteredExponentialBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public RateLimitRetryExecutor(
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      MeterRegistry meterRegistry) {
    this(retryAfterParser, backoff, duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RateLimitRetryExecutor(
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.retryAfterParser =
        Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(Operation<T> operation, RetryBudget budget) {
    Objects.requireNonNull(budget, "budget must not be null");
    int retry = 0;
    while (true) {
      try {
        return operation.run();
      } catch (TwilioApiException ex) {
        if (!ex.isRateLimitError()) {
          throw ex;
        }
        if (!budget.tryConsume(ex)) {
          meterRegistry.counter(EXHAUSTED_COUNTER).increment();
          log.warn(
              "Twilio rate-limit retries exhausted retries={} twilioCode={} requestId={}",
              retry,
              ex.twilioCode(),
              ex.carrierHeaders().requestId());
          throw ex;
        }
        retry++;
        Duration wait = resolveBackoff(ex, retry);
        meterRegistry.counter(RETRY_COUNTER).increment();
        log.warn(
            "Twilio rate limited retry={} waitMs={} twilioCode={} message={}",
            retry,
            wait.toMillis(),
            ex.twilioCode(),
            ex.twilioMessage());
        sleep(wait);
      }
    }
  }

  private Duration resolveBackoff(TwilioApiException ex, int retry) {
    Duration computed = backoff.backoffForAttempt(retry);
    return ex.retryAfterHeader()
        .flatMap(retryAfterParser::parse)
        .map(retryAfter -> minDuration(retryAfter, backoff.maxBackoff()))
        .orElse(computed);
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new TwilioConnectorException(
          "Interrupted during Twilio rate-limit backoff",
          TwilioConnectorException.IO_FAILURE_STATUS,
          interrupted);
    }
  }

  private static Duration minDuration(Duration left, Duration right) {
    return left.compareTo(right) <= 0 ? left : right;
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  /** Decides whether one more rate-limited try is allowed, recording it when it is. */
  @FunctionalInterface
  public interface RetryBudget {
    boolean tryConsume(TwilioApiException rateLimited);
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
