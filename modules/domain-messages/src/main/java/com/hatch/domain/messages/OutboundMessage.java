package com.hatch.domain.messages;

import java.util.UUID;

public record OutboundMessage(String to, String from, String body) {
  public OutboundMessage {
    requireNonBlank(to, "to");
    requireNonBlank(from, "from");
    if (body == null) {
      throw new MessageDomainException("body must not be null");
    }
  }

  public UUID conversationId() {
    return ConversationIds.derive(to, from);
  }

  public boolean isPhoneToPhone() {
    return isPhoneNumber(to) && isPhoneNumber(from);
  }

  public static boolean isPhoneNumber(String contact) {
    return contact != null && contact.startsWith("+");
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new MessageDomainException(fieldName + " must not be blank");
    }
  }
}
