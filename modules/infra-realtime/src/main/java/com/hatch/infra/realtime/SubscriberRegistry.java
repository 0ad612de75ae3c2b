package com.hatch.infra.realtime;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live push subscribers plus the lifecycle of the change stream feeding them. The stream runs while
 * at least one subscriber is registered.
 *
 * <p>Membership changes take a short lock that is never held while calling the stream. Starting
 * and stopping the stream is reconciled under a separate lock acquired with {@code tryLock}: a
 * thread that loses the race leaves a pending flag that the lock holder drains, so the stream's own
 * worker can prune the last subscriber while another thread is stopping it.
 */
public class SubscriberRegistry implements ChangeEventHandler {
  private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);

  private final ChangeNotificationStream changeStream;
  private final ChangeEventCodec codec;
  private final MeterRegistry meterRegistry;
  private final Object membershipLock = new Object();
  private final Map<UUID, Subscription> members = new LinkedHashMap<>();
  private final ReentrantLock lifecycleLock = new ReentrantLock();
  private final AtomicBoolean reconcilePending = new AtomicBoolean(false);
  private final AtomicInteger activeGauge = new AtomicInteger(0);

  public SubscriberRegistry(
      ChangeNotificationStream changeStream, ChangeEventCodec codec, MeterRegistry meterRegistry) {
    this.changeStream = Objects.requireNonNull(changeStream, "changeStream is required");
    this.codec = Objects.requireNonNull(codec, "codec is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    meterRegistry.gauge("realtime.subscribers.active", activeGauge);
  }

  public Subscription addSubscriber(Outbox outbox) {
    Subscription subscription = new Subscription(UUID.randomUUID(), outbox);
    boolean first;
    int total;
    synchronized (membershipLock) {
      members.put(subscription.id(), subscription);
      total = members.size();
      first = total == 1;
      activeGauge.set(total);
    }
    log.info("Added push subscriber id={} total={}", subscription.id(), total);
    if (first) {
      reconcileStream();
    }
    return subscription;
  }

  public void removeSubscriber(Subscription subscription) {
    if (subscription == null) {
      return;
    }
    boolean removed;
    boolean last;
    int total;
    synchronized (membershipLock) {
      removed = members.remove(subscription.id()) != null;
      total = members.size();
      last = removed && total == 0;
      activeGauge.set(total);
    }
    if (!removed) {
      return;
    }
    log.info("Removed push subscriber id={} total={}", subscription.id(), total);
    if (last) {
      reconcileStream();
    }
  }

  /**
   * Serializes the event once and offers it to every current subscriber. Subscribers whose outbox
   * refuses it are removed after the sweep.
   */
  public void broadcast(ChangeEvent event) {
    String serialized = codec.encode(event);
    List<Subscription> snapshot;
    synchronized (membershipLock) {
      snapshot = List.copyOf(members.values());
    }
    List<Subscription> failed = new ArrayList<>();
    for (Subscription subscription : snapshot) {
      try {
        if (!subscription.outbox().offer(serialized)) {
          failed.add(subscription);
        }
      } catch (RuntimeException ex) {
        log.warn("Push to subscriber failed id={}", subscription.id(), ex);
        failed.add(subscription);
      }
    }
    meterRegistry.counter("realtime.broadcast.total", "type", event.kind().wireName()).increment();
    if (!failed.isEmpty()) {
      prune(failed);
    }
    log.debug(
        "Broadcast change event type={} conversationId={} recipients={} pruned={}",
        event.kind().wireName(),
        event.conversationId(),
        snapshot.size() - failed.size(),
        failed.size());
  }

  @Override
  public void onChange(ChangeEvent event) {
    broadcast(event);
  }

  @Override
  public void onError(String errorCode, String errorMessage, Throwable error) {
    log.debug("Change stream reported error code={} message={}", errorCode, errorMessage);
  }

  public int subscriberCount() {
    synchronized (membershipLock) {
      return members.size();
    }
  }

  public boolean isListening() {
    return changeStream.isRunning();
  }

  /** Drops every subscriber and stops the change stream. */
  public void shutdown() {
    int dropped;
    synchronized (membershipLock) {
      dropped = members.size();
      members.clear();
      activeGauge.set(0);
    }
    log.info("Shutting down subscriber registry dropped={}", dropped);
    reconcileStream();
  }

  private void prune(List<Subscription> failed) {
    int removedCount = 0;
    boolean emptied;
    synchronized (membershipLock) {
      for (Subscription subscription : failed) {
        if (members.remove(subscription.id()) != null) {
          removedCount++;
        }
      }
      emptied = removedCount > 0 && members.isEmpty();
      activeGauge.set(members.size());
    }
    if (removedCount == 0) {
      return;
    }
    meterRegistry.counter("realtime.broadcast.pruned.total").increment(removedCount);
    log.info("Pruned unreachable push subscribers count={}", removedCount);
    if (emptied) {
      reconcileStream();
    }
  }

  private void reconcileStream() {
    reconcilePending.set(true);
    while (reconcilePending.get()) {
      if (!lifecycleLock.tryLock()) {
        // The holder re-checks the pending flag before releasing.
        return;
      }
      try {
        while (reconcilePending.getAndSet(false)) {
          applyStreamState();
        }
      } finally {
        lifecycleLock.unlock();
      }
    }
  }

  private void applyStreamState() {
    boolean wanted;
    synchronized (membershipLock) {
      wanted = !members.isEmpty();
    }
    try {
      if (wanted) {
        changeStream.start(this);
      } else {
        changeStream.stop();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to reconcile change stream wanted={}", wanted, ex);
    }
  }
}
