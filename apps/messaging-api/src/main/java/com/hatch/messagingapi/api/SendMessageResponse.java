package com.hatch.messagingapi.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hatch.messagingapi.messages.SendResult;
import java.util.Locale;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendMessageResponse(
    boolean success, UUID messageId, UUID conversationId, String status, String method) {
  public static SendMessageResponse from(SendResult result) {
    return new SendMessageResponse(
        true,
        result.messageId(),
        result.conversationId(),
        result.status(),
        result.method().name().toLowerCase(Locale.ROOT));
  }
}
