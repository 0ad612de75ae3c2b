package com.hatch.infra.realtime;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens dedicated connections outside any pool: a LISTEN registration lives as long as its session,
 * so a pooled connection must never carry one back into the pool.
 */
public class PgListenerConnectionFactory implements ListenerConnectionFactory {
  private static final String APPLICATION_NAME = "hatch-change-listener";

  private final String jdbcUrl;
  private final String username;
  private final String password;
  private final int connectTimeoutSeconds;

  public PgListenerConnectionFactory(
      String jdbcUrl, String username, String password, int connectTimeoutSeconds) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("jdbcUrl is required");
    }
    if (connectTimeoutSeconds <= 0) {
      throw new IllegalArgumentException("connectTimeoutSeconds must be > 0");
    }
    this.jdbcUrl = jdbcUrl;
    this.username = username;
    this.password = password;
    this.connectTimeoutSeconds = connectTimeoutSeconds;
  }

  @Override
  public ListenerConnection open() throws SQLException {
    Properties properties = new Properties();
    if (username != null) {
      properties.setProperty("user", username);
    }
    if (password != null) {
      properties.setProperty("password", password);
    }
    properties.setProperty("ApplicationName", APPLICATION_NAME);
    properties.setProperty("connectTimeout", Integer.toString(connectTimeoutSeconds));
    properties.setProperty("loginTimeout", Integer.toString(connectTimeoutSeconds));
    properties.setProperty("tcpKeepAlive", "true");
    Connection connection = DriverManager.getConnection(jdbcUrl, properties);
    try {
      return new PgListenerConnection(connection);
    } catch (SQLException | RuntimeException ex) {
      connection.close();
      throw ex;
    }
  }
}
