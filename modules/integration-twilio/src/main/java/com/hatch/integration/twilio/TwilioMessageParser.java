package com.hatch.integration.twilio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hatch.domain.messages.DeliveryRecord;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

public class TwilioMessageParser {
  private final ObjectMapper objectMapper;

  public TwilioMessageParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public DeliveryRecord parseRecord(String body) {
    JsonNode root = readObject(body);
    if (root == null) {
      throw new TwilioConnectorException(
          "Twilio message response is not a JSON object", TwilioConnectorException.IO_FAILURE_STATUS);
    }
    return new DeliveryRecord(
        optionalText(root, "sid"),
        optionalText(root, "account_sid"),
        optionalText(root, "to"),
        optionalText(root, "from"),
        optionalText(root, "body"),
        optionalText(root, "status"),
        optionalText(root, "direction"),
        optionalInteger(root, "error_code"),
        optionalText(root, "error_message"),
        intOrDefault(root, "num_media", 0),
        intOrDefault(root, "num_segments", 1),
        optionalDecimal(root, "price"),
        optionalText(root, "price_unit"),
        parseTimestamp(optionalText(root, "date_created")),
        parseTimestamp(optionalText(root, "date_sent")),
        parseTimestamp(optionalText(root, "date_updated")));
  }

  /** Reads the carrier's error document leniently; fields it cannot find are null. */
  public TwilioErrorPayload parseError(String body) {
    JsonNode root;
    try {
      root = readObject(body);
    } catch (TwilioConnectorException ex) {
      return TwilioErrorPayload.EMPTY;
    }
    if (root == null) {
      return TwilioErrorPayload.EMPTY;
    }
    return new TwilioErrorPayload(
        optionalInteger(root, "code"),
        optionalText(root, "message"),
        optionalText(root, "more_info"));
  }

  /** Accepts the carrier's RFC 2822 dates and ISO-8601 offsets. Unparseable values yield null. */
  static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String candidate = value.trim();
    try {
      return ZonedDateTime.parse(candidate, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
    } catch (DateTimeParseException ignored) {
      // Fall through to ISO-8601.
    }
    try {
      return OffsetDateTime.parse(candidate).toInstant();
    } catch (DateTimeParseException ignored) {
      return null;
    }
  }

  private JsonNode readObject(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      return root != null && root.isObject() ? root : null;
    } catch (IOException ex) {
      throw new TwilioConnectorException(
          "Failed to parse Twilio response JSON", TwilioConnectorException.IO_FAILURE_STATUS, ex);
    }
  }

  private static String optionalText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    return node.asText();
  }

  private static Integer optionalInteger(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.canConvertToInt()) {
      return node.intValue();
    }
    String text = node.asText().trim();
    try {
      return text.isEmpty() ? null : Integer.valueOf(text);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static int intOrDefault(JsonNode root, String field, int defaultValue) {
    Integer value = optionalInteger(root, field);
    return value == null ? defaultValue : value;
  }

  private static BigDecimal optionalDecimal(JsonNode root, String field) {
    String text = optionalText(root, field);
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(text.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  public record TwilioErrorPayload(Integer code, String message, String moreInfo) {
    static final TwilioErrorPayload EMPTY = new TwilioErrorPayload(null, null, null);
  }
}
