package com.hatch.infra.realtime;

import io.micrometer.core.instrument.MeterRegistry;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PostgresChangeListener implements ChangeNotificationStream {
  private static final Logger log = LoggerFactory.getLogger(PostgresChangeListener.class);

  private static final String THREAD_NAME_PREFIX = "hatch-change-listener-";
  private static final String CONNECT_ERROR_CODE = "CONNECT_FAILED";
  private static final String POLL_ERROR_CODE = "POLL_FAILED";
  private static final String PARSE_ERROR_CODE = "PARSE_ERROR";
  private static final String HANDLER_ERROR_CODE = "HANDLER_ERROR";

  private final ListenerConnectionFactory connectionFactory;
  private final ChangeEventParser parser;
  private final ChangeListenerConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Object lifecycleMonitor = new Object();
  private final AtomicBoolean connected = new AtomicBoolean(false);
  private final AtomicInteger connectionStateGauge = new AtomicInteger(0);
  private final AtomicLong reconnectAttempts = new AtomicLong(0L);
  private final AtomicInteger workerSequence = new AtomicInteger(0);

  // guarded by lifecycleMonitor
  private Worker current;
  private Worker lastStopped;

  public PostgresChangeListener(
      ListenerConnectionFactory connectionFactory,
      ChangeEventParser parser,
      ChangeListenerConfig config,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.connectionFactory =
        Objects.requireNonNull(connectionFactory, "connectionFactory is required");
    this.parser = Objects.requireNonNull(parser, "parser is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    meterRegistry.gauge("realtime.listener.connection.state", connectionStateGauge);
  }

  @Override
  public void start(ChangeEventHandler eventHandler) {
    ChangeEventHandler handler = eventHandler == null ? ChangeEventHandler.noop() : eventHandler;
    synchronized (lifecycleMonitor) {
      if (current != null) {
        return;
      }
      Worker previous = lastStopped;
      Worker worker = new Worker(handler, previous);
      Thread thread = new Thread(worker, THREAD_NAME_PREFIX + workerSequence.incrementAndGet());
      thread.setDaemon(true);
      worker.thread = thread;
      current = worker;
      thread.start();
    }
    log.info("Change listener started channels={}", config.channels());
  }

  @Override
  public void stop() {
    Worker worker;
    synchronized (lifecycleMonitor) {
      worker = current;
      current = null;
      if (worker != null) {
        lastStopped = worker;
      }
    }
    if (worker == null) {
      return;
    }
    worker.shutdown();
    if (Thread.currentThread() != worker.thread) {
      worker.awaitTermination();
    }
    log.info("Change listener stopped channels={}", config.channels());
  }

  @Override
  public boolean isRunning() {
    synchronized (lifecycleMonitor) {
      return current != null;
    }
  }

  @Override
  public boolean isConnected() {
    return connected.get();
  }

  @Override
  public long reconnectAttempts() {
    return reconnectAttempts.get();
  }

  private void updateConnected(boolean value) {
    connected.set(value);
    connectionStateGauge.set(value ? 1 : 0);
  }

  static String sanitizeMessage(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    if (compact.length() <= 300) {
      return compact;
    }
    return compact.substring(0, 300);
  }

  private final class Worker implements Runnable {
    private final ChangeEventHandler handler;
    private Worker previous;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running = true;
    private volatile Thread thread;
    private ListenerConnection connection;

    private Worker(ChangeEventHandler handler, Worker previous) {
      this.handler = handler;
      this.previous = previous;
    }

    @Override
    public void run() {
      awaitPrevious();
      try {
        while (running) {
          if (connection == null || !connection.isValid()) {
            if (!connect()) {
              pause(config.reconnectDelay());
              continue;
            }
          }
          List<RawNotification> batch;
          try {
            batch = connection.poll(config.pollTimeout());
          } catch (SQLException | RuntimeException ex) {
            onConnectionFailure(POLL_ERROR_CODE, ex);
            pause(config.reconnectDelay());
            continue;
          }
          for (RawNotification notification : batch) {
            if (!running) {
              break;
            }
            dispatch(notification);
          }
          pause(config.idleInterval());
        }
      } finally {
        closeConnection();
        updateConnected(false);
      }
    }

    private boolean connect() {
      closeConnection();
      ListenerConnection fresh = null;
      try {
        fresh = connectionFactory.open();
        fresh.listen(config.channels());
      } catch (SQLException | RuntimeException ex) {
        if (fresh != null) {
          fresh.close();
        }
        onConnectionFailure(CONNECT_ERROR_CODE, ex);
        return false;
      }
      connection = fresh;
      updateConnected(true);
      log.info("Listening for change notifications channels={}", config.channels());
      notifyHandler(() -> handler.onConnected(config.channels()));
      return true;
    }

    private void dispatch(RawNotification notification) {
      String channel = notification.channel();
      ChangeEvent event;
      try {
        event = parser.parse(notification, clock.instant());
      } catch (ChangeEventParseException ex) {
        countNotification(channel, "parse_error");
        log.warn(
            "Dropping malformed change notification channel={} reason={}",
            channel,
            sanitizeMessage(ex));
        notifyHandler(() -> handler.onError(PARSE_ERROR_CODE, sanitizeMessage(ex), ex));
        return;
      }
      countNotification(channel, "emitted");
      try {
        handler.onChange(event);
      } catch (RuntimeException ex) {
        meterRegistry
            .counter("realtime.listener.errors.total", "error", HANDLER_ERROR_CODE)
            .increment();
        log.error(
            "Change handler failed channel={} conversationId={}",
            channel,
            event.conversationId(),
            ex);
      }
    }

    private void onConnectionFailure(String code, Exception error) {
      closeConnection();
      updateConnected(false);
      meterRegistry.counter("realtime.listener.errors.total", "error", code).increment();
      if (!running) {
        return;
      }
      long attempt = reconnectAttempts.incrementAndGet();
      meterRegistry.counter("realtime.listener.reconnect.total").increment();
      Duration delay = config.reconnectDelay();
      log.warn(
          "Change listener connection failed code={} attempt={} retryInMs={} reason={}",
          code,
          attempt,
          delay.toMillis(),
          sanitizeMessage(error));
      notifyHandler(() -> handler.onError(code, sanitizeMessage(error), error));
      notifyHandler(() -> handler.onReconnectScheduled(attempt, delay));
    }

    private void notifyHandler(Runnable callback) {
      try {
        callback.run();
      } catch (RuntimeException ex) {
        log.warn("Change handler callback failed", ex);
      }
    }

    private void countNotification(String channel, String outcome) {
      meterRegistry
          .counter(
              "realtime.listener.notifications.total",
              "channel",
              channel == null ? "none" : channel,
              "outcome",
              outcome)
          .increment();
    }

    private void pause(Duration duration) {
      if (!running || duration.isZero()) {
        return;
      }
      try {
        stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        running = false;
      }
    }

    private void closeConnection() {
      ListenerConnection existing = connection;
      connection = null;
      if (existing != null) {
        existing.close();
      }
    }

    private void awaitPrevious() {
      Worker predecessor = previous;
      previous = null;
      if (predecessor == null || predecessor.thread == Thread.currentThread()) {
        return;
      }
      try {
        predecessor.thread.join();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        running = false;
      }
    }

    private void shutdown() {
      running = false;
      stopSignal.countDown();
    }

    private void awaitTermination() {
      try {
        thread.join();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for change listener worker {}", thread.getName());
      }
    }
  }
}
