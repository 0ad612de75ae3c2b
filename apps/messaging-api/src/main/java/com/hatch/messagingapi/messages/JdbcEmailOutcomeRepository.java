package com.hatch.messagingapi.messages;

import com.hatch.domain.messages.OutboundEmail;
import com.hatch.integration.sendgrid.EmailDeliveryOutcome;
import com.hatch.integration.sendgrid.EmailOutcomeStore;
import java.sql.Timestamp;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Writes email sends into {@code messages} as type {@code email}, upserting on message id. */
@Repository
public class JdbcEmailOutcomeRepository implements EmailOutcomeStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcEmailOutcomeRepository.class);

  static final String MESSAGE_TYPE = "email";
  private static final String OUTBOUND_DIRECTION = "outbound-api";

  private final JdbcTemplate jdbcTemplate;

  public JdbcEmailOutcomeRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public UUID saveEmailOutcome(EmailDeliveryOutcome outcome) {
    String sql =
        """
        INSERT INTO messages (
            id,
            conversation_id,
            to_contact,
            from_contact,
            body,
            subject,
            html_content,
            type,
            timestamp,
            status,
            external_sid,
            direction,
            error_code,
            error_message,
            date_sent,
            date_updated
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (id) DO UPDATE SET
            status = EXCLUDED.status,
            external_sid = EXCLUDED.external_sid,
            error_code = EXCLUDED.error_code,
            error_message = EXCLUDED.error_message,
            date_sent = EXCLUDED.date_sent,
            date_updated = EXCLUDED.date_updated
        """;
    OutboundEmail email = outcome.email();
    Timestamp completedAt = Timestamp.from(outcome.completedAt());
    jdbcTemplate.update(
        sql,
        outcome.messageId(),
        outcome.conversationId(),
        email.to(),
        email.from(),
        email.storedBody(),
        email.subject(),
        email.htmlContent(),
        MESSAGE_TYPE,
        completedAt,
        outcome.status(),
        outcome.providerMessageId(),
        OUTBOUND_DIRECTION,
        outcome.isSent() ? null : outcome.providerStatus(),
        outcome.errorMessage(),
        outcome.isSent() ? completedAt : null,
        completedAt);
    log.info(
        "Persisted email outcome messageId={} conversationId={} status={} providerMessageId={}",
        outcome.messageId(),
        outcome.conversationId(),
        outcome.status(),
        outcome.providerMessageId());
    return outcome.messageId();
  }
}
