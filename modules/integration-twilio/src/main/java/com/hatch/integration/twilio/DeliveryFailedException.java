package com.hatch.integration.twilio;

import com.hatch.domain.messages.DeliveryOutcome;
import java.util.Objects;

/** The send ended in a persisted failure, for example an exhausted rate-limit budget. */
public class DeliveryFailedException extends RuntimeException {
  private final DeliveryOutcome outcome;

  public DeliveryFailedException(String message, DeliveryOutcome outcome, Throwable cause) {
    super(message, cause);
    this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
  }

  public DeliveryOutcome outcome() {
    return outcome;
  }
}
