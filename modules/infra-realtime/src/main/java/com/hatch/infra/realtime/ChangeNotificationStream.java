package com.hatch.infra.realtime;

public interface ChangeNotificationStream {
  /** Starts the listen loop; a no-op while it is already running. */
  void start(ChangeEventHandler eventHandler);

  /** Stops the loop. No events reach the handler once this returns. */
  void stop();

  boolean isRunning();

  boolean isConnected();

  long reconnectAttempts();
}
