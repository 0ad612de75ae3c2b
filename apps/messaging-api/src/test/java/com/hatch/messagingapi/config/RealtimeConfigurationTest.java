package com.hatch.messagingapi.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hatch.infra.realtime.ChangeListenerConfig;
import com.hatch.infra.realtime.ChangeNotificationStream;
import com.hatch.infra.realtime.ListenerConnectionFactory;
import com.hatch.infra.realtime.SubscriberRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.jdbc.JdbcConnectionDetails;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class RealtimeConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(RealtimeConfiguration.class)
          .withBean(ObjectMapper.class, ObjectMapper::new)
          .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
          .withBean(JdbcConnectionDetails.class, StaticConnectionDetails::new);

  @Test
  void shouldRegisterIdleRegistryWithoutConnecting() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(SubscriberRegistry.class);
          assertThat(context).hasSingleBean(ListenerConnectionFactory.class);
          assertThat(context).hasBean("eventStreamExecutor");
          SubscriberRegistry registry = context.getBean(SubscriberRegistry.class);
          assertThat(registry.subscriberCount()).isZero();
          assertThat(registry.isListening()).isFalse();
          assertThat(context.getBean(ChangeNotificationStream.class).isRunning()).isFalse();
        });
  }

  @Test
  void shouldBindListenerSettings() {
    contextRunner
        .withPropertyValues(
            "realtime.listener.channels=message_changes",
            "realtime.listener.poll-timeout-ms=500",
            "realtime.listener.reconnect-delay-ms=1000")
        .run(
            context -> {
              ChangeListenerConfig config =
                  context.getBean(RealtimeListenerProperties.class).toListenerConfig();
              assertThat(config.channels()).isEqualTo(List.of("message_changes"));
              assertThat(config.pollTimeout()).isEqualTo(Duration.ofMillis(500));
              assertThat(config.reconnectDelay()).isEqualTo(Duration.ofSeconds(1));
              assertThat(config.idleInterval()).isEqualTo(Duration.ofMillis(100));
            });
  }

  @Test
  void shouldRejectInvalidChannelName() {
    contextRunner
        .withPropertyValues("realtime.listener.channels=message-changes; DROP TABLE messages")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void shouldBackOffWhenDisabled() {
    contextRunner
        .withPropertyValues("realtime.listener.enabled=false")
        .run(context -> assertThat(context).doesNotHaveBean(SubscriberRegistry.class));
  }

  private static final class StaticConnectionDetails implements JdbcConnectionDetails {
    @Override
    public String getUsername() {
      return "hatch";
    }

    @Override
    public String getPassword() {
      return "hatch_pass";
    }

    @Override
    public String getJdbcUrl() {
      return "jdbc:postgresql://localhost:5432/hatch";
    }
  }
}
