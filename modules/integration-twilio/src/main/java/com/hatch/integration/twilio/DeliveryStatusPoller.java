package com.hatch.integration.twilio;

import com.hatch.domain.messages.DeliveryAttempt;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the carrier for the status of an accepted message until it is terminal or the attempt's
 * poll budget is spent. The wait before poll {@code n} grows as {@code base * 2^n}.
 */
public class DeliveryStatusPoller {
  private static final Logger log = LoggerFactory.getLogger(DeliveryStatusPoller.class);

  private static final String POLL_COUNTER = "delivery.pipeline.poll.total";

  private final TwilioMessagingClient client;
  private final JitteredExponentialBackoff backoff;
  private final RateLimitRetryExecutor.Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public DeliveryStatusPoller(
      TwilioMessagingClient client,
      JitteredExponentialBackoff backoff,
      RateLimitRetryExecutor.Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  /**
   * Drives {@code attempt} to completion. A poll that fails on I/O still uses up a slot; an error
   * status from the carrier propagates as {@link TwilioApiException}.
   */
  public void pollUntilComplete(DeliveryAttempt attempt) {
    Objects.requireNonNull(attempt, "attempt must not be null");
    while (attempt.needsStatusPoll()) {
      int pollNumber = attempt.deliveryPollCount() + 1;
      sleep(backoff.backoffForAttempt(pollNumber));
      CarrierResponse response;
      try {
        response = client.fetchStatus(attempt.carrierRef());
      } catch (TwilioConnectorException ex) {
        attempt.recordMissedPoll();
        meterRegistry.counter(POLL_COUNTER, "outcome", "missed").increment();
        log.warn(
            "Twilio status poll failed messageId={} sid={} poll={} reason={}",
            attempt.messageId(),
            attempt.carrierRef(),
            pollNumber,
            ex.getMessage());
        continue;
      } catch (TwilioApiException ex) {
        meterRegistry.counter(POLL_COUNTER, "outcome", "error").increment();
        log.error(
            "Twilio status poll rejected messageId={} sid={} status={} twilioCode={} moreInfo={}",
            attempt.messageId(),
            attempt.carrierRef(),
            ex.statusCode(),
            ex.twilioCode(),
            ex.moreInfo());
        throw ex;
      }
      attempt.recordPoll(response.record());
      meterRegistry.counter(POLL_COUNTER, "outcome", "observed").increment();
      log.debug(
          "Twilio status poll messageId={} sid={} poll={} status={} requestId={}",
          attempt.messageId(),
          attempt.carrierRef(),
          pollNumber,
          response.record().status(),
          response.headers().requestId());
    }
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
          "Interrupted during Twilio status poll backoff",
          TwilioConnectorException.IO_FAILURE_STATUS,
          interrupted);
    }
  }
}
