package com.hatch.infra.realtime;

import java.sql.SQLException;

@FunctionalInterface
public interface ListenerConnectionFactory {
  ListenerConnection open() throws SQLException;
}
