package com.hatch.infra.realtime;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PgListenerConnection implements ListenerConnection {
  private static final Logger log = LoggerFactory.getLogger(PgListenerConnection.class);

  private final Connection connection;
  private final PGConnection pgConnection;
  private volatile boolean broken;

  public PgListenerConnection(Connection connection) throws SQLException {
    this.connection = Objects.requireNonNull(connection, "connection is required");
    this.connection.setAutoCommit(true);
    this.pgConnection = connection.unwrap(PGConnection.class);
  }

  @Override
  public void listen(Collection<String> channels) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      for (String channel : channels) {
        NotificationChannels.assertValid(channel);
        statement.execute("LISTEN " + channel);
      }
    } catch (SQLException ex) {
      broken = true;
      throw ex;
    }
  }

  @Override
  public List<RawNotification> poll(Duration timeout) throws SQLException {
    // pgjdbc treats a zero timeout as "block until a notification arrives".
    int timeoutMillis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    PGNotification[] notifications;
    try {
      notifications = pgConnection.getNotifications(timeoutMillis);
    } catch (SQLException ex) {
      broken = true;
      throw ex;
    }
    if (notifications == null || notifications.length == 0) {
      return List.of();
    }
    List<RawNotification> result = new ArrayList<>(notifications.length);
    for (PGNotification notification : notifications) {
      result.add(
          new RawNotification(
              notification.getName(), notification.getParameter(), notification.getPID()));
    }
    return result;
  }

  @Override
  public boolean isValid() {
    if (broken) {
      return false;
    }
    try {
      return !connection.isClosed();
    } catch (SQLException ex) {
      return false;
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException ex) {
      log.debug("Failed to close listener connection", ex);
    }
  }
}
