package com.hatch.domain.messages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OutboundMessageTest {
  @Test
  void shouldDeriveConversationFromEndpoints() {
    OutboundMessage message = new OutboundMessage("+15550002222", "+15550001111", "hi");

    assertEquals(
        ConversationIds.derive("+15550001111", "+15550002222"), message.conversationId());
    assertTrue(message.isPhoneToPhone());
  }

  @Test
  void shouldDetectNamedContacts() {
    assertFalse(new OutboundMessage("alice", "+15550001111", "hi").isPhoneToPhone());
  }

  @Test
  void shouldRejectMissingEndpoints() {
    assertThrows(MessageDomainException.class, () -> new OutboundMessage("", "+1555", "hi"));
    assertThrows(MessageDomainException.class, () -> new OutboundMessage("+1555", "+1556", null));
  }
}
