package com.hatch.domain.messages;

import java.math.BigDecimal;
import java.time.Instant;

/** Carrier message resource, normalized from a submit or status response. */
public record DeliveryRecord(
    String sid,
    String accountSid,
    String to,
    String from,
    String body,
    String status,
    String direction,
    Integer errorCode,
    String errorMessage,
    int numMedia,
    int numSegments,
    BigDecimal price,
    String priceUnit,
    Instant dateCreated,
    Instant dateSent,
    Instant dateUpdated) {
  public DeliveryPhase phase() {
    return DeliveryPhase.fromCarrierStatus(status);
  }

  public boolean hasError() {
    return errorCode != null || (errorMessage != null && !errorMessage.isBlank());
  }
}
