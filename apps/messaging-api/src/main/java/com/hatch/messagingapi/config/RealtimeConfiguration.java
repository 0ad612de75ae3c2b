package com.hatch.messagingapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hatch.infra.realtime.ChangeEventCodec;
import com.hatch.infra.realtime.ChangeEventParser;
import com.hatch.infra.realtime.ChangeNotificationStream;
import com.hatch.infra.realtime.ListenerConnectionFactory;
import com.hatch.infra.realtime.PgListenerConnectionFactory;
import com.hatch.infra.realtime.PostgresChangeListener;
import com.hatch.infra.realtime.SubscriberRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcConnectionDetails;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties({RealtimeListenerProperties.class, RealtimeStreamProperties.class})
@ConditionalOnProperty(
    prefix = "realtime.listener",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RealtimeConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ChangeEventParser changeEventParser(ObjectMapper objectMapper) {
    return new ChangeEventParser(objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  public ChangeEventCodec changeEventCodec(ObjectMapper objectMapper) {
    return new ChangeEventCodec(objectMapper);
  }

  /** Listener sessions bypass the pool; the same coordinates are used for a dedicated session. */
  @Bean
  @ConditionalOnMissingBean
  public ListenerConnectionFactory listenerConnectionFactory(
      JdbcConnectionDetails connectionDetails, RealtimeListenerProperties properties) {
    return new PgListenerConnectionFactory(
        connectionDetails.getJdbcUrl(),
        connectionDetails.getUsername(),
        connectionDetails.getPassword(),
        properties.getConnectTimeoutSeconds());
  }

  @Bean
  @ConditionalOnMissingBean
  public ChangeNotificationStream changeNotificationStream(
      ListenerConnectionFactory listenerConnectionFactory,
      ChangeEventParser changeEventParser,
      RealtimeListenerProperties properties,
      MeterRegistry meterRegistry) {
    return new PostgresChangeListener(
        listenerConnectionFactory,
        changeEventParser,
        properties.toListenerConfig(),
        meterRegistry,
        Clock.systemUTC());
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public SubscriberRegistry subscriberRegistry(
      ChangeNotificationStream changeNotificationStream,
      ChangeEventCodec changeEventCodec,
      MeterRegistry meterRegistry) {
    return new SubscriberRegistry(changeNotificationStream, changeEventCodec, meterRegistry);
  }

  /** One thread per open stream; each blocks on its outbox between frames. */
  @Bean(name = "eventStreamExecutor", destroyMethod = "shutdownNow")
  @ConditionalOnMissingBean(name = "eventStreamExecutor")
  public ExecutorService eventStreamExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("hatch-event-stream-");
    threadFactory.setDaemon(true);
    return Executors.newCachedThreadPool(threadFactory);
  }
}
