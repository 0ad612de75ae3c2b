package com.hatch.domain.messages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ConversationIdsTest {
  @Test
  void shouldMatchKnownIdentifierForPhonePair() {
    assertEquals(
        UUID.fromString("4adf8ccd-c10c-675f-0e8a-ef7cd3a46260"),
        ConversationIds.derive("+15550001111", "+15550002222"));
  }

  @Test
  void shouldMatchKnownIdentifierForNamedContact() {
    assertEquals(
        UUID.fromString("ab481f9e-41c4-e597-64f5-fb17b1001cf9"),
        ConversationIds.derive("alice", "+15550001111"));
  }

  @Test
  void shouldOrderSupplementaryCharactersByCodePoint() {
    String fullwidthA = "\uFF21";
    String grinningFace = "\uD83D\uDE00";

    assertTrue(fullwidthA.compareTo(grinningFace) > 0);
    assertTrue(ConversationIds.compareCodePoints(fullwidthA, grinningFace) < 0);
    assertEquals(
        UUID.fromString("5c8b2f23-ec64-0932-5aaf-38a1c3101d13"),
        ConversationIds.derive(grinningFace, fullwidthA));
    assertEquals(
        ConversationIds.derive(grinningFace, fullwidthA),
        ConversationIds.derive(fullwidthA, grinningFace));
  }

  @Test
  void shouldBeIndependentOfDirection() {
    List<List<String>> pairs =
        List.of(
            List.of("+15550001111", "+15550002222"),
            List.of("bob@example.com", "+447700900123"),
            List.of("same", "same"),
            List.of("Zed", "alpha"));
    for (List<String> pair : pairs) {
      assertEquals(
          ConversationIds.derive(pair.get(0), pair.get(1)),
          ConversationIds.derive(pair.get(1), pair.get(0)),
          () -> "pair " + pair);
    }
  }

  @Test
  void shouldDistinguishDifferentPairs() {
    assertNotEquals(
        ConversationIds.derive("+15550001111", "+15550002222"),
        ConversationIds.derive("+15550001111", "+15550003333"));
  }

  @Test
  void shouldRejectBlankContacts() {
    assertThrows(MessageDomainException.class, () -> ConversationIds.derive(" ", "+15550001111"));
    assertThrows(MessageDomainException.class, () -> ConversationIds.derive("+15550001111", null));
  }
}
