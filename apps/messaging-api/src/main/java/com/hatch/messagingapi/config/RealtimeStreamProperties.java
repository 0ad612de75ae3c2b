package com.hatch.messagingapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.stream")
public class RealtimeStreamProperties {
  private long keepaliveIntervalMs = 30000L;
  /** Zero leaves the emitter open until the client goes away. */
  private long emitterTimeoutMs = 0L;
  /** Zero means unbounded. */
  private int outboxCapacity = 0;

  public long getKeepaliveIntervalMs() {
    return keepaliveIntervalMs;
  }

  public void setKeepaliveIntervalMs(long keepaliveIntervalMs) {
    this.keepaliveIntervalMs = keepaliveIntervalMs;
  }

  public long getEmitterTimeoutMs() {
    return emitterTimeoutMs;
  }

  public void setEmitterTimeoutMs(long emitterTimeoutMs) {
    this.emitterTimeoutMs = emitterTimeoutMs;
  }

  public int getOutboxCapacity() {
    return outboxCapacity;
  }

  public void setOutboxCapacity(int outboxCapacity) {
    this.outboxCapacity = outboxCapacity;
  }
}
