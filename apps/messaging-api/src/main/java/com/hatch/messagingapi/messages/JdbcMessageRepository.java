package com.hatch.messagingapi.messages;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcMessageRepository implements MessageRepository {
  private static final String MESSAGE_COLUMNS =
      """
      SELECT id,
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
             error_message
      FROM messages
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcMessageRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void insert(StoredMessage message) {
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
            status
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        message.id(),
        message.conversationId(),
        message.toContact(),
        message.fromContact(),
        message.body(),
        message.type(),
        Timestamp.from(message.timestamp()),
        message.status());
  }

  @Override
  public List<ConversationView> findConversations() {
    // Inbound rows name the remote party first so both directions list the same pair.
    String sql =
        """
        SELECT conversation_id,
               MAX(timestamp) AS last_message_date,
               COUNT(*) AS message_count,
               CASE WHEN direction = 'inbound-api'
                    THEN CONCAT(from_contact, ', ', to_contact)
                    ELSE CONCAT(to_contact, ', ', from_contact)
               END AS participants
        FROM messages
        GROUP BY conversation_id, 4
        ORDER BY last_message_date DESC
        """;
    return jdbcTemplate.query(sql, JdbcMessageRepository::mapConversation);
  }

  @Override
  public List<MessageView> findByConversationId(UUID conversationId) {
    String sql = MESSAGE_COLUMNS + " WHERE conversation_id = ? ORDER BY timestamp ASC, id ASC";
    return jdbcTemplate.query(sql, JdbcMessageRepository::mapMessage, conversationId);
  }

  @Override
  public List<MessageView> findByConversationIdSince(UUID conversationId, Instant since) {
    String sql =
        MESSAGE_COLUMNS
            + " WHERE conversation_id = ? AND timestamp > ? ORDER BY timestamp ASC, id ASC";
    return jdbcTemplate.query(
        sql, JdbcMessageRepository::mapMessage, conversationId, Timestamp.from(since));
  }

  @Override
  public Optional<ConversationParticipants> findParticipants(UUID conversationId) {
    String sql =
        """
        SELECT to_contact, from_contact
        FROM messages
        WHERE conversation_id = ?
        ORDER BY timestamp ASC
        LIMIT 1
        """;
    List<ConversationParticipants> rows =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) ->
                new ConversationParticipants(rs.getString("to_contact"), rs.getString("from_contact")),
            conversationId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  private static ConversationView mapConversation(ResultSet rs, int rowNum) throws SQLException {
    return new ConversationView(
        rs.getObject("conversation_id", UUID.class),
        rs.getString("participants"),
        toInstant(rs.getTimestamp("last_message_date")),
        rs.getLong("message_count"));
  }

  private static MessageView mapMessage(ResultSet rs, int rowNum) throws SQLException {
    return new MessageView(
        rs.getObject("id", UUID.class),
        rs.getObject("conversation_id", UUID.class),
        rs.getString("to_contact"),
        rs.getString("from_contact"),
        rs.getString("body"),
        rs.getString("type"),
        toInstant(rs.getTimestamp("timestamp")),
        rs.getString("status"),
        rs.getString("external_sid"),
        rs.getString("direction"),
        rs.getObject("error_code", Integer.class),
        rs.getString("error_message"));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
