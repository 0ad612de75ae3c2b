package com.hatch.infra.realtime;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/** One raw notification connection. Replaced, never repaired, once it stops being valid. */
public interface ListenerConnection extends AutoCloseable {
  void listen(Collection<String> channels) throws SQLException;

  /** Returns the notifications received within {@code timeout}; never blocks indefinitely. */
  List<RawNotification> poll(Duration timeout) throws SQLException;

  boolean isValid();

  @Override
  void close();
}
