package com.hatch.integration.sendgrid;

import java.util.UUID;

/** Persists the outcome of an email send, keyed by its message id. */
public interface EmailOutcomeStore {
  UUID saveEmailOutcome(EmailDeliveryOutcome outcome);
}
