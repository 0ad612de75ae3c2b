package com.hatch.messagingapi.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hatch.domain.messages.OutboundMessage;
import com.hatch.messagingapi.messages.ConversationView;
import java.time.Instant;
import java.util.Arrays;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationResponse(
    UUID conversationId,
    String participants,
    Instant lastMessageDate,
    long messageCount,
    boolean hasPhoneNumbers) {
  public static ConversationResponse from(ConversationView view) {
    boolean hasPhoneNumbers =
        view.participants() != null
            && Arrays.stream(view.participants().split(", "))
                .anyMatch(OutboundMessage::isPhoneNumber);
    return new ConversationResponse(
        view.conversationId(),
        view.participants(),
        view.lastMessageDate(),
        view.messageCount(),
        hasPhoneNumbers);
  }
}
