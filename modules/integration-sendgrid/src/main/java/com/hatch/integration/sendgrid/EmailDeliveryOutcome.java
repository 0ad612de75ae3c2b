package com.hatch.integration.sendgrid;

import com.hatch.domain.messages.OutboundEmail;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Final state of one email send. {@code providerStatus} is the HTTP status SendGrid answered
 * with, or 500 when no answer was obtained.
 */
public record EmailDeliveryOutcome(
    UUID messageId,
    OutboundEmail email,
    String status,
    int providerStatus,
    String providerMessageId,
    String errorMessage,
    Instant completedAt) {
  public static final String SENT = "sent";
  public static final String FAILED = "failed";

  public EmailDeliveryOutcome {
    Objects.requireNonNull(messageId, "messageId must not be null");
    Objects.requireNonNull(email, "email must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(completedAt, "completedAt must not be null");
  }

  public UUID conversationId() {
    return email.conversationId();
  }

  public boolean isSent() {
    return SENT.equals(status);
  }
}
