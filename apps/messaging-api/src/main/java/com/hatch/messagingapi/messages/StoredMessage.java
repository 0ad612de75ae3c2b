package com.hatch.messagingapi.messages;

import com.hatch.domain.messages.ConversationIds;
import java.time.Instant;
import java.util.UUID;

/** A message written straight to the store without going through the carrier. */
public record StoredMessage(
    UUID id,
    String toContact,
    String fromContact,
    String body,
    String type,
    Instant timestamp,
    String status) {
  public UUID conversationId() {
    return ConversationIds.derive(toContact, fromContact);
  }
}
