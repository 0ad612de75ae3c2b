package com.hatch.infra.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Serializes change events and control frames into the JSON pushed to stream subscribers. */
public class ChangeEventCodec {
  private final ObjectMapper objectMapper;

  public ChangeEventCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  public String encode(ChangeEvent event) {
    Objects.requireNonNull(event, "event is required");
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", event.kind().wireName());
    node.put("conversation_id", event.conversationId());
    node.put("action", event.action() == null ? null : event.action().wireName());
    node.put("message_id", event.messageId());
    node.put("timestamp", epochSeconds(event.observedAt()));
    return write(node);
  }

  public String encodeControl(String type, Instant at) {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("type is required");
    }
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", type);
    node.put("timestamp", at.toString());
    return write(node);
  }

  static BigDecimal epochSeconds(Instant instant) {
    return BigDecimal.valueOf(instant.toEpochMilli(), 3);
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize stream frame", ex);
    }
  }
}
