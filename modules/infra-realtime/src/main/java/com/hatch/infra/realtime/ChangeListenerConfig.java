package com.hatch.infra.realtime;

import java.time.Duration;
import java.util.List;

public record ChangeListenerConfig(
    List<String> channels, Duration idleInterval, Duration pollTimeout, Duration reconnectDelay) {
  public static final Duration DEFAULT_IDLE_INTERVAL = Duration.ofMillis(100);
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(250);
  public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

  public ChangeListenerConfig {
    if (channels == null || channels.isEmpty()) {
      throw new IllegalArgumentException("channels must not be empty");
    }
    channels.forEach(NotificationChannels::assertValid);
    channels = List.copyOf(channels);
    if (idleInterval == null || idleInterval.isNegative()) {
      throw new IllegalArgumentException("idleInterval must be >= 0");
    }
    if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be > 0");
    }
    if (reconnectDelay == null || reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("reconnectDelay must be >= 0");
    }
  }

  public static ChangeListenerConfig defaults() {
    return new ChangeListenerConfig(
        NotificationChannels.defaults(),
        DEFAULT_IDLE_INTERVAL,
        DEFAULT_POLL_TIMEOUT,
        DEFAULT_RECONNECT_DELAY);
  }
}
