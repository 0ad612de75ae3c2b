package com.hatch.domain.messages;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

public record DeliveryOutcome(
    UUID messageId,
    UUID conversationId,
    OutboundMessage message,
    DeliveryPhase phase,
    DeliveryRecord lastRecord,
    Integer failureCode,
    String failureMessage,
    int retryCount,
    int deliveryPollCount,
    boolean budgetExhausted,
    Instant completedAt) {
  public DeliveryOutcome {
    Objects.requireNonNull(messageId, "messageId must not be null");
    Objects.requireNonNull(conversationId, "conversationId must not be null");
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(phase, "phase must not be null");
    Objects.requireNonNull(completedAt, "completedAt must not be null");
  }

  /** Raw carrier status when one was observed, otherwise the phase name in lower case. */
  public String status() {
    if (lastRecord != null && lastRecord.status() != null && !lastRecord.status().isBlank()) {
      return lastRecord.status();
    }
    return phase.name().toLowerCase(Locale.ROOT);
  }

  public String carrierRef() {
    return lastRecord == null ? null : lastRecord.sid();
  }
}
