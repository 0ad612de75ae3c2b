package com.hatch.messagingapi.realtime;

import com.hatch.infra.realtime.ChangeEventCodec;
import com.hatch.infra.realtime.QueueOutbox;
import com.hatch.infra.realtime.SubscriberRegistry;
import com.hatch.infra.realtime.Subscription;
import com.hatch.messagingapi.config.RealtimeStreamProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Bridges one server-sent-events connection to the subscriber registry. Each stream owns an outbox
 * and a drain task that forwards queued frames, writing a keepalive frame whenever the outbox stays
 * empty for a full keepalive interval.
 */
@Service
@ConditionalOnProperty(
    prefix = "realtime.listener",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EventStreamService {
  private static final Logger log = LoggerFactory.getLogger(EventStreamService.class);

  static final String CONNECTED_FRAME = "connected";
  static final String KEEPALIVE_FRAME = "keepalive";

  private final SubscriberRegistry subscriberRegistry;
  private final ChangeEventCodec codec;
  private final RealtimeStreamProperties properties;
  private final ExecutorService executor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public EventStreamService(
      SubscriberRegistry subscriberRegistry,
      ChangeEventCodec codec,
      RealtimeStreamProperties properties,
      @Qualifier("eventStreamExecutor") ExecutorService executor,
      MeterRegistry meterRegistry) {
    this(subscriberRegistry, codec, properties, executor, meterRegistry, Clock.systemUTC());
  }

  EventStreamService(
      SubscriberRegistry subscriberRegistry,
      ChangeEventCodec codec,
      RealtimeStreamProperties properties,
      ExecutorService executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.subscriberRegistry = subscriberRegistry;
    this.codec = codec;
    this.properties = properties;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public SseEmitter open() {
    SseEmitter emitter = new SseEmitter(properties.getEmitterTimeoutMs());
    return open(emitter);
  }

  SseEmitter open(SseEmitter emitter) {
    QueueOutbox outbox =
        properties.getOutboxCapacity() > 0
            ? new QueueOutbox(properties.getOutboxCapacity())
            : new QueueOutbox();
    Subscription subscription = subscriberRegistry.addSubscriber(outbox);
    emitter.onCompletion(outbox::close);
    emitter.onTimeout(
        () -> {
          outbox.close();
          emitter.complete();
        });
    emitter.onError(error -> outbox.close());
    try {
      executor.execute(() -> drain(emitter, outbox, subscription));
    } catch (RejectedExecutionException ex) {
      outbox.close();
      subscriberRegistry.removeSubscriber(subscription);
      throw ex;
    }
    meterRegistry.counter("realtime.stream.opened.total").increment();
    return emitter;
  }

  void drain(SseEmitter emitter, QueueOutbox outbox, Subscription subscription) {
    Duration keepalive = Duration.ofMillis(properties.getKeepaliveIntervalMs());
    try {
      send(emitter, codec.encodeControl(CONNECTED_FRAME, clock.instant()));
      while (!outbox.isClosed()) {
        Optional<String> next = outbox.poll(keepalive);
        if (next.isPresent()) {
          send(emitter, next.get());
        } else if (!outbox.isClosed()) {
          send(emitter, codec.encodeControl(KEEPALIVE_FRAME, clock.instant()));
        }
      }
    } catch (IOException | IllegalStateException ex) {
      // Client went away; the container reports the failure to the emitter.
      log.debug(
          "Event stream write failed subscriptionId={} reason={}",
          subscription.id(),
          ex.toString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      emitter.complete();
    } finally {
      outbox.close();
      subscriberRegistry.removeSubscriber(subscription);
      meterRegistry.counter("realtime.stream.closed.total").increment();
    }
  }

  private static void send(SseEmitter emitter, String frame) throws IOException {
    emitter.send(SseEmitter.event().data(frame));
  }
}
