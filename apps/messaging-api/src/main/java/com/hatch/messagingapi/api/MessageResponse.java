package com.hatch.messagingapi.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hatch.messagingapi.messages.MessageView;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageResponse(
    UUID id,
    String toContact,
    String fromContact,
    String body,
    String type,
    Instant timestamp,
    String status,
    String externalSid,
    String direction,
    Integer errorCode,
    String errorMessage,
    @JsonProperty("is_delivered") boolean delivered) {
  private static final Set<String> DELIVERED_STATUSES = Set.of("delivered", "sent");

  public static MessageResponse from(MessageView view) {
    return new MessageResponse(
        view.id(),
        view.toContact(),
        view.fromContact(),
        view.body(),
        view.type(),
        view.timestamp(),
        view.status(),
        view.externalSid(),
        view.direction(),
        view.errorCode(),
        view.errorMessage(),
        view.status() != null && DELIVERED_STATUSES.contains(view.status()));
  }
}
