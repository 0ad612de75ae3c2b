package com.hatch.messagingapi.config;

import com.hatch.infra.realtime.ChangeListenerConfig;
import com.hatch.infra.realtime.NotificationChannels;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.listener")
public class RealtimeListenerProperties {
  private boolean enabled = true;
  private List<String> channels = new ArrayList<>(NotificationChannels.defaults());
  private long idleIntervalMs = 100L;
  private long pollTimeoutMs = 250L;
  private long reconnectDelayMs = 5000L;
  private int connectTimeoutSeconds = 10;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getChannels() {
    return channels;
  }

  public void setChannels(List<String> channels) {
    this.channels = channels;
  }

  public long getIdleIntervalMs() {
    return idleIntervalMs;
  }

  public void setIdleIntervalMs(long idleIntervalMs) {
    this.idleIntervalMs = idleIntervalMs;
  }

  public long getPollTimeoutMs() {
    return pollTimeoutMs;
  }

  public void setPollTimeoutMs(long pollTimeoutMs) {
    this.pollTimeoutMs = pollTimeoutMs;
  }

  public long getReconnectDelayMs() {
    return reconnectDelayMs;
  }

  public void setReconnectDelayMs(long reconnectDelayMs) {
    this.reconnectDelayMs = reconnectDelayMs;
  }

  public int getConnectTimeoutSeconds() {
    return connectTimeoutSeconds;
  }

  public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
    this.connectTimeoutSeconds = connectTimeoutSeconds;
  }

  public ChangeListenerConfig toListenerConfig() {
    return new ChangeListenerConfig(
        channels,
        Duration.ofMillis(idleIntervalMs),
        Duration.ofMillis(pollTimeoutMs),
        Duration.ofMillis(reconnectDelayMs));
  }
}
