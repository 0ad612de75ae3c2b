package com.hatch.infra.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Objects;

public class ChangeEventParser {
  private final ObjectMapper objectMapper;

  public ChangeEventParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  /**
   * Normalizes one notification. An empty payload yields an event with only the kind set; a
   * payload that is not a JSON object is rejected.
   */
  public ChangeEvent parse(RawNotification notification, Instant observedAt) {
    Objects.requireNonNull(notification, "notification is required");
    String channel = notification.channel();
    ChangeEventKind kind = NotificationChannels.kindFor(channel);
    String payload = notification.payload();
    if (payload == null || payload.isBlank()) {
      return new ChangeEvent(kind, null, null, null, observedAt);
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new ChangeEventParseException(
          channel, "Notification payload is not valid JSON channel=" + channel, ex);
    }
    if (root == null || !root.isObject()) {
      throw new ChangeEventParseException(
          channel, "Notification payload must be a JSON object channel=" + channel, null);
    }

    return new ChangeEvent(
        kind,
        scalarText(root, "conversation_id", channel),
        ChangeAction.fromWire(scalarText(root, "action", channel)),
        scalarText(root, "message_id", channel),
        observedAt);
  }

  private static String scalarText(JsonNode root, String field, String channel) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isValueNode()) {
      throw new ChangeEventParseException(
          channel, "Notification field " + field + " must be a scalar channel=" + channel, null);
    }
    String value = node.asText();
    return value.isBlank() ? null : value;
  }
}
