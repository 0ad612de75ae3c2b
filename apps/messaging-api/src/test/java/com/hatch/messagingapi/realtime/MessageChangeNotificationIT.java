package com.hatch.messagingapi.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hatch.domain.messages.ConversationIds;
import com.hatch.infra.realtime.ChangeEventCodec;
import com.hatch.infra.realtime.ChangeEventParser;
import com.hatch.infra.realtime.ChangeListenerConfig;
import com.hatch.infra.realtime.NotificationChannels;
import com.hatch.infra.realtime.PgListenerConnectionFactory;
import com.hatch.infra.realtime.PostgresChangeListener;
import com.hatch.infra.realtime.QueueOutbox;
import com.hatch.infra.realtime.SubscriberRegistry;
import com.hatch.infra.realtime.Subscription;
import com.hatch.messagingapi.messages.JdbcMessageRepository;
import com.hatch.messagingapi.messages.StoredMessage;
import com.hatch.testsupport.containers.PostgresContainerBaseIT;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class MessageChangeNotificationIT extends PostgresContainerBaseIT {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private JdbcMessageRepository messageRepository;
  private PostgresChangeListener listener;
  private SubscriberRegistry registry;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource = new DriverManagerDataSource();
    dataSource.setDriverClassName(postgres.getDriverClassName());
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUsername(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .cleanDisabled(false)
            .load();
    flyway.clean();
    flyway.migrate();
    messageRepository = new JdbcMessageRepository(new JdbcTemplate(dataSource));

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    listener =
        new PostgresChangeListener(
            new PgListenerConnectionFactory(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword(), 5),
            new ChangeEventParser(objectMapper),
            new ChangeListenerConfig(
                NotificationChannels.defaults(),
                Duration.ofMillis(20),
                Duration.ofMillis(100),
                Duration.ofMillis(200)),
            meterRegistry,
            Clock.systemUTC());
    registry = new SubscriberRegistry(listener, new ChangeEventCodec(objectMapper), meterRegistry);
  }

  @AfterEach
  void tearDown() {
    registry.shutdown();
  }

  @Test
  void shouldPushInsertedMessageToSubscriber() throws Exception {
    QueueOutbox outbox = new QueueOutbox();
    Subscription subscription = registry.addSubscriber(outbox);
    awaitListening();

    UUID messageId = UUID.randomUUID();
    messageRepository.insert(
        new StoredMessage(
            messageId, "Alice", "Front Desk", "Hello", "sms", Instant.now(), "sent"));

    Map<String, JsonNode> byType = new HashMap<>();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (byType.size() < 2 && System.nanoTime() < deadline) {
      Optional<String> frame = outbox.poll(Duration.ofMillis(200));
      if (frame.isPresent()) {
        JsonNode node = objectMapper.readTree(frame.get());
        byType.put(node.get("type").asText(), node);
      }
    }

    String conversationId = ConversationIds.derive("Alice", "Front Desk").toString();
    JsonNode messageUpdate = byType.get("message_update");
    assertNotNull(messageUpdate);
    assertEquals(conversationId, messageUpdate.get("conversation_id").asText());
    assertEquals("INSERT", messageUpdate.get("action").asText());
    assertEquals(messageId.toString(), messageUpdate.get("message_id").asText());
    JsonNode conversationUpdate = byType.get("conversation_update");
    assertNotNull(conversationUpdate);
    assertEquals(conversationId, conversationUpdate.get("conversation_id").asText());

    registry.removeSubscriber(subscription);
    assertFalse(registry.isListening());
  }

  private void awaitListening() throws InterruptedException {
    // LISTEN must be registered before the insert commits or the notification is lost.
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!listener.isConnected()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("listener did not connect within 5s");
      }
      Thread.sleep(20L);
    }
  }
}
