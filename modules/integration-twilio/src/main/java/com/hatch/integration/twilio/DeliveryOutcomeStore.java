package com.hatch.integration.twilio;

import com.hatch.domain.messages.DeliveryOutcome;
import java.util.UUID;

public interface DeliveryOutcomeStore {
  /** Persists the outcome; saving the same message id again overwrites the earlier row. */
  UUID saveDeliveryOutcome(DeliveryOutcome outcome);
}
