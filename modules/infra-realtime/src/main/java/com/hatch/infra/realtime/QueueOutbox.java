package com.hatch.infra.realtime;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public class QueueOutbox implements Outbox {
  private final BlockingQueue<String> queue;
  private volatile boolean closed;

  public QueueOutbox() {
    this.queue = new LinkedBlockingQueue<>();
  }

  public QueueOutbox(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public boolean offer(String serializedEvent) {
    if (serializedEvent == null) {
      throw new IllegalArgumentException("serializedEvent is required");
    }
    if (closed) {
      return false;
    }
    return queue.offer(serializedEvent);
  }

  /** Waits up to {@code timeout} for the next event; empty on timeout or once closed and drained. */
  public Optional<String> poll(Duration timeout) throws InterruptedException {
    String next = queue.poll();
    if (next != null || closed) {
      return Optional.ofNullable(next);
    }
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public int size() {
    return queue.size();
  }
}
