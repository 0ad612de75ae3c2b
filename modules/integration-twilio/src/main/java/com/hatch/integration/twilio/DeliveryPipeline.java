package com.hatch.integration.twilio;

import com.hatch.domain.messages.DeliveryAttempt;
import com.hatch.domain.messages.DeliveryBudget;
import com.hatch.domain.messages.DeliveryOutcome;
import com.hatch.domain.messages.OutboundMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one outbound SMS: submit with rate-limit backoff, poll delivery status, then persist the
 * final outcome exactly once. Runs on the caller's thread.
 */
public class DeliveryPipeline {
  private static final Logger log = LoggerFactory.getLogger(DeliveryPipeline.class);

  private static final String OUTCOME_COUNTER = "delivery.pipeline.outcome.total";

  private final TwilioMessagingClient client;
  private final RateLimitRetryExecutor submitExecutor;
  private final DeliveryStatusPoller statusPoller;
  private final DeliveryOutcomeStore outcomeStore;
  private final DeliveryBudget budget;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public DeliveryPipeline(
      TwilioMessagingClient client,
      RateLimitRetryExecutor submitExecutor,
      DeliveryStatusPoller statusPoller,
      DeliveryOutcomeStore outcomeStore,
      DeliveryBudget budget,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.submitExecutor = Objects.requireNonNull(submitExecutor, "submitExecutor must not be null");
    this.statusPoller = Objects.requireNonNull(statusPoller, "statusPoller must not be null");
    this.outcomeStore = Objects.requireNonNull(outcomeStore, "outcomeStore must not be null");
    this.budget = Objects.requireNonNull(budget, "budget must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public DeliveryOutcome send(OutboundMessage message) {
    DeliveryAttempt attempt = DeliveryAttempt.start(message, budget);
    log.info(
        "Submitting SMS messageId={} conversationId={} to={}",
        attempt.messageId(),
        message.conversationId(),
        message.to());

    CarrierResponse accepted;
    try {
      accepted =
          submitExecutor.execute(
              () -> client.submit(message),
              rateLimited ->
                  attempt.registerRateLimit(
                      rateLimited.twilioCode(), rateLimited.twilioMessage()));
    } catch (TwilioApiException ex) {
      if (attempt.isComplete()) {
        DeliveryOutcome outcome = complete(attempt);
        throw new DeliveryFailedException(
            "Twilio rate-limit budget exhausted after " + attempt.retryCount() + " retries",
            outcome,
            ex);
      }
      log.error(
          "Twilio rejected SMS messageId={} status={} twilioCode={} message={} moreInfo={}",
          attempt.messageId(),
          ex.statusCode(),
          ex.twilioCode(),
          ex.twilioMessage(),
          ex.moreInfo());
      throw ex;
    } catch (TwilioConnectorException ex) {
      log.error(
          "Twilio submission failed without a response messageId={}", attempt.messageId(), ex);
      throw ex;
    }

    attempt.recordAccepted(accepted.record());
    log.info(
        "Twilio accepted SMS messageId={} sid={} status={} retries={} requestId={}",
        attempt.messageId(),
        attempt.carrierRef(),
        accepted.record().status(),
        attempt.retryCount(),
        accepted.headers().requestId());

    statusPoller.pollUntilComplete(attempt);
    return complete(attempt);
  }

  private DeliveryOutcome complete(DeliveryAttempt attempt) {
    DeliveryOutcome outcome = attempt.toOutcome(clock.instant());
    outcomeStore.saveDeliveryOutcome(outcome);
    meterRegistry
        .counter(OUTCOME_COUNTER, "phase", outcome.phase().name().toLowerCase(Locale.ROOT))
        .increment();
    log.info(
        "Delivery finished messageId={} sid={} phase={} status={} retries={} polls={}"
            + " budgetExhausted={}",
        outcome.messageId(),
        outcome.carrierRef(),
        outcome.phase(),
        outcome.status(),
        outcome.retryCount(),
        outcome.deliveryPollCount(),
        outcome.budgetExhausted());
    return outcome;
  }
}
