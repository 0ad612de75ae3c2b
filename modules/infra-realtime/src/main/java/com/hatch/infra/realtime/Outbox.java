package com.hatch.infra.realtime;

/** A subscriber's FIFO queue of serialized events. */
public interface Outbox {
  /**
   * Enqueues without blocking. Returns false when the subscriber can no longer take events, which
   * tells the registry to drop it.
   */
  boolean offer(String serializedEvent);
}
