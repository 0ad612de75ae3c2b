package com.hatch.messagingapi.messages;

public record ConversationParticipants(String toContact, String fromContact) {
  /** The contact on the other side of {@code contact}, or the sender when it matches neither. */
  public String counterpartOf(String contact) {
    return toContact.equals(contact) ? fromContact : toContact;
  }
}
