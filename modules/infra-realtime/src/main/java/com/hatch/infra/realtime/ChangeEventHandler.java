package com.hatch.infra.realtime;

import java.time.Duration;
import java.util.List;

public interface ChangeEventHandler {
  default void onConnected(List<String> channels) {}

  default void onReconnectScheduled(long reconnectAttempts, Duration delay) {}

  default void onChange(ChangeEvent event) {}

  default void onError(String errorCode, String errorMessage, Throwable error) {}

  static ChangeEventHandler noop() {
    return new ChangeEventHandler() {};
  }
}
