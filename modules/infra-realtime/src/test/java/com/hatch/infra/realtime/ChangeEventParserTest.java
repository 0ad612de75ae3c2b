package com.hatch.infra.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ChangeEventParserTest {
  private static final Instant NOW = Instant.parse("2026-03-02T09:15:00Z");

  private final ChangeEventParser parser = new ChangeEventParser(new ObjectMapper());

  @Test
  void shouldNormalizeMessageNotification() {
    ChangeEvent event =
        parser.parse(
            new RawNotification(
                "message_changes",
                """
                {"conversation_id": "4adf8ccd-c10c-675f-0e8a-ef7cd3a46260",
                 "action": "update", "message_id": 17, "extra": {"ignored": true}}
                """,
                7),
            NOW);

    assertEquals(ChangeEventKind.MESSAGE_UPDATE, event.kind());
    assertEquals("4adf8ccd-c10c-675f-0e8a-ef7cd3a46260", event.conversationId());
    assertEquals(ChangeAction.UPDATE, event.action());
    assertEquals("17", event.messageId());
    assertEquals(NOW, event.observedAt());
  }

  @Test
  void shouldTolerateMissingFieldsAndUnknownChannels() {
    ChangeEvent empty = parser.parse(new RawNotification("conversation_changes", "", 7), NOW);
    assertEquals(ChangeEventKind.CONVERSATION_UPDATE, empty.kind());
    assertNull(empty.conversationId());
    assertNull(empty.action());

    ChangeEvent unknown =
        parser.parse(
            new RawNotification("billing_changes", "{\"action\":\"TRUNCATE\"}", 7), NOW);
    assertEquals(ChangeEventKind.UNKNOWN, unknown.kind());
    assertNull(unknown.action());
    assertNull(unknown.messageId());
  }

  @Test
  void shouldRejectMalformedPayloads() {
    ChangeEventParseException invalidJson =
        assertThrows(
            ChangeEventParseException.class,
            () -> parser.parse(new RawNotification("message_changes", "{oops", 7), NOW));
    assertEquals("message_changes", invalidJson.channel());

    assertThrows(
        ChangeEventParseException.class,
        () -> parser.parse(new RawNotification("message_changes", "\"text\"", 7), NOW));
    assertThrows(
        ChangeEventParseException.class,
        () ->
            parser.parse(
                new RawNotification("message_changes", "{\"conversation_id\":[1]}", 7), NOW));
  }
}
