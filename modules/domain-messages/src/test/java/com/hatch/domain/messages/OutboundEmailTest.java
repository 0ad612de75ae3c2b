package com.hatch.domain.messages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OutboundEmailTest {
  @Test
  void shouldShareConversationWithReverseDirection() {
    OutboundEmail email =
        new OutboundEmail("guest@example.com", "desk@hatch.test", "Booking", "See you", null);

    assertEquals(
        ConversationIds.derive("desk@hatch.test", "guest@example.com"), email.conversationId());
  }

  @Test
  void shouldStorePlainTextThenHtmlThenPlaceholder() {
    assertEquals(
        "plain",
        new OutboundEmail("a@x.test", "b@x.test", "s", "plain", "<p>html</p>").storedBody());
    assertEquals(
        "<p>html</p>",
        new OutboundEmail("a@x.test", "b@x.test", "s", null, "<p>html</p>").storedBody());
    assertEquals(
        "No content provided", new OutboundEmail("a@x.test", "b@x.test", "s", "", null).storedBody());
  }

  @Test
  void shouldRecognizeAddresses() {
    assertTrue(OutboundEmail.isEmailAddress("guest@example.com"));
    assertFalse(OutboundEmail.isEmailAddress("+15550001111"));
    assertFalse(OutboundEmail.isEmailAddress("@example.com"));
    assertFalse(OutboundEmail.isEmailAddress("guest@"));
    assertFalse(OutboundEmail.isEmailAddress("a@b@c"));
  }

  @Test
  void shouldRejectInvalidEnvelope() {
    assertThrows(
        MessageDomainException.class,
        () -> new OutboundEmail("+15550001111", "b@x.test", "s", "hi", null));
    assertThrows(
        MessageDomainException.class, () -> new OutboundEmail("a@x.test", "b@x.test", " ", "hi", null));
  }
}
