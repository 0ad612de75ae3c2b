package com.hatch.domain.messages;

import java.util.Locale;

public enum DeliveryPhase {
  SUBMITTED,
  RATE_LIMITED,
  SENT,
  DELIVERED,
  UNDELIVERED,
  FAILED;

  public boolean isTerminal() {
    return this == DELIVERED || this == UNDELIVERED || this == FAILED;
  }

  /** Anything the carrier reports that is not one of its three final states counts as in flight. */
  public static DeliveryPhase fromCarrierStatus(String carrierStatus) {
    if (carrierStatus == null) {
      return SENT;
    }
    return switch (carrierStatus.trim().toLowerCase(Locale.ROOT)) {
      case "delivered" -> DELIVERED;
      case "undelivered" -> UNDELIVERED;
      case "failed" -> FAILED;
      default -> SENT;
    };
  }
}
