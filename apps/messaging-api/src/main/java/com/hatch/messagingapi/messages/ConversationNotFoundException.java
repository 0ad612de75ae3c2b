package com.hatch.messagingapi.messages;

import java.util.UUID;

public class ConversationNotFoundException extends RuntimeException {
  private final UUID conversationId;

  public ConversationNotFoundException(UUID conversationId) {
    super("Conversation not found: " + conversationId);
    this.conversationId = conversationId;
  }

  public UUID conversationId() {
    return conversationId;
  }
}
