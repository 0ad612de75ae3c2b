package com.hatch.messagingapi.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hatch.messagingapi.messages.SendMessageCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record SendMessageRequest(
    @JsonProperty("conversation_id") UUID conversationId,
    @NotBlank String to,
    String from,
    @NotNull String content) {
  public SendMessageCommand toCommand() {
    return new SendMessageCommand(conversationId, to, from, content);
  }
}
