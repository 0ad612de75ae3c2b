package com.hatch.infra.realtime;

import java.time.Instant;

public record ChangeEvent(
    ChangeEventKind kind,
    String conversationId,
    ChangeAction action,
    String messageId,
    Instant observedAt) {
  public ChangeEvent {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    if (observedAt == null) {
      throw new IllegalArgumentException("observedAt is required");
    }
  }
}
