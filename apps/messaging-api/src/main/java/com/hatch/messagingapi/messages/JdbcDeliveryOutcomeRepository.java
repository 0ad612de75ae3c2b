package com.hatch.messagingapi.messages;

import com.hatch.domain.messages.DeliveryOutcome;
import com.hatch.domain.messages.DeliveryRecord;
import com.hatch.integration.twilio.DeliveryOutcomeStore;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Writes the final state of a carrier delivery into {@code messages}. Keyed by message id, so a
 * repeated save overwrites instead of duplicating.
 */
@Repository
public class JdbcDeliveryOutcomeRepository implements DeliveryOutcomeStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcDeliveryOutcomeRepository.class);

  private static final String MESSAGE_TYPE = "sms";
  private static final String OUTBOUND_DIRECTION = "outbound-api";

  private final JdbcTemplate jdbcTemplate;

  public JdbcDeliveryOutcomeRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public UUID saveDeliveryOutcome(DeliveryOutcome outcome) {
    String sql =
        """
        INSERT INTO messages (
            id,
            conversation_id,
            to_contact,
            from_contact,
            body,
            type,
            timestamp,
            status,
            external_sid,
            direction,
            error_code,
            error_message,
            num_media,
            num_segments,
            price,
            price_unit,
            date_sent,
            date_updated,
            retry_count,
            delivery_poll_count
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (id) DO UPDATE SET
            status = EXCLUDED.status,
            external_sid = EXCLUDED.external_sid,
            direction = EXCLUDED.direction,
            error_code = EXCLUDED.error_code,
            error_message = EXCLUDED.error_message,
            num_media = EXCLUDED.num_media,
            num_segments = EXCLUDED.num_segments,
            price = EXCLUDED.price,
            price_unit = EXCLUDED.price_unit,
            date_sent = EXCLUDED.date_sent,
            date_updated = EXCLUDED.date_updated,
            retry_count = EXCLUDED.retry_count,
            delivery_poll_count = EXCLUDED.delivery_poll_count
        """;
    DeliveryRecord record = outcome.lastRecord();
    Instant createdAt =
        record != null && record.dateCreated() != null ? record.dateCreated() : outcome.completedAt();
    jdbcTemplate.update(
        sql,
        outcome.messageId(),
        outcome.conversationId(),
        outcome.message().to(),
        outcome.message().from(),
        outcome.message().body(),
        MESSAGE_TYPE,
        Timestamp.from(createdAt),
        outcome.status(),
        outcome.carrierRef(),
        record != null && record.direction() != null ? record.direction() : OUTBOUND_DIRECTION,
        errorCode(outcome),
        errorMessage(outcome),
        record == null ? 0 : record.numMedia(),
        record == null ? 1 : record.numSegments(),
        record == null ? null : record.price(),
        record == null || record.priceUnit() == null ? "USD" : record.priceUnit(),
        toTimestamp(record == null ? null : record.dateSent()),
        toTimestamp(record == null ? outcome.completedAt() : record.dateUpdated()),
        outcome.retryCount(),
        outcome.deliveryPollCount());
    log.info(
        "Persisted delivery outcome messageId={} conversationId={} status={} carrierRef={}",
        outcome.messageId(),
        outcome.conversationId(),
        outcome.status(),
        outcome.carrierRef());
    return outcome.messageId();
  }

  private static Integer errorCode(DeliveryOutcome outcome) {
    DeliveryRecord record = outcome.lastRecord();
    if (record != null && record.errorCode() != null) {
      return record.errorCode();
    }
    return outcome.failureCode();
  }

  private static String errorMessage(DeliveryOutcome outcome) {
    DeliveryRecord record = outcome.lastRecord();
    if (record != null && record.errorMessage() != null) {
      return record.errorMessage();
    }
    return outcome.failureMessage();
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }
}
