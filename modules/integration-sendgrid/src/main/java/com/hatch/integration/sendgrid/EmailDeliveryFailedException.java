package com.hatch.integration.sendgrid;

import java.util.Objects;

/** SendGrid did not accept the email. The failed outcome has already been persisted. */
public class EmailDeliveryFailedException extends RuntimeException {
  private final EmailDeliveryOutcome outcome;

  public EmailDeliveryFailedException(
      String message, EmailDeliveryOutcome outcome, Throwable cause) {
    super(message, cause);
    this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
  }

  public EmailDeliveryOutcome outcome() {
    return outcome;
  }
}
