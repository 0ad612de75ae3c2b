package com.hatch.infra.realtime;

import java.util.UUID;

public record Subscription(UUID id, Outbox outbox) {
  public Subscription {
    if (id == null) {
      throw new IllegalArgumentException("id is required");
    }
    if (outbox == null) {
      throw new IllegalArgumentException("outbox is required");
    }
  }
}
