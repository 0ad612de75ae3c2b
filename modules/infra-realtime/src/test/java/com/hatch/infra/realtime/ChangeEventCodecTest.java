package com.hatch.infra.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ChangeEventCodecTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ChangeEventCodec codec = new ChangeEventCodec(objectMapper);

  @Test
  void shouldEncodeEventWithNullFieldsAndEpochSecondTimestamp() throws Exception {
    String json =
        codec.encode(
            new ChangeEvent(
                ChangeEventKind.CONVERSATION_UPDATE,
                "c-1",
                null,
                null,
                Instant.parse("2026-03-02T09:15:00.125Z")));

    JsonNode node = objectMapper.readTree(json);
    assertEquals("conversation_update", node.get("type").asText());
    assertEquals("c-1", node.get("conversation_id").asText());
    assertEquals(true, node.get("action").isNull());
    assertEquals(true, node.get("message_id").isNull());
    assertEquals(new BigDecimal("1772442900.125"), node.get("timestamp").decimalValue());
  }

  @Test
  void shouldEncodeControlFrames() throws Exception {
    JsonNode node =
        objectMapper.readTree(
            codec.encodeControl("keepalive", Instant.parse("2026-03-02T09:15:00Z")));

    assertEquals("keepalive", node.get("type").asText());
    assertEquals("2026-03-02T09:15:00Z", node.get("timestamp").asText());
    assertThrows(IllegalArgumentException.class, () -> codec.encodeControl(" ", Instant.EPOCH));
  }
}
