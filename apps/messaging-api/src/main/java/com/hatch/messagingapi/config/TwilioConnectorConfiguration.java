package com.hatch.messagingapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hatch.domain.messages.DeliveryBudget;
import com.hatch.integration.twilio.DeliveryOutcomeStore;
import com.hatch.integration.twilio.DeliveryPipeline;
import com.hatch.integration.twilio.DeliveryStatusPoller;
import com.hatch.integration.twilio.JitteredExponentialBackoff;
import com.hatch.integration.twilio.RateLimitRetryExecutor;
import com.hatch.integration.twilio.RestTwilioMessagingClient;
import com.hatch.integration.twilio.RetryAfterParser;
import com.hatch.integration.twilio.TwilioApiConfig;
import com.hatch.integration.twilio.TwilioConnectorProperties;
import com.hatch.integration.twilio.TwilioMessageParser;
import com.hatch.integration.twilio.TwilioMessagingClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(TwilioConnectorProperties.class)
@ConditionalOnProperty(prefix = "connector.twilio", name = "enabled", havingValue = "true")
public class TwilioConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "twilioConnectorClock")
  public Clock twilioConnectorClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public TwilioApiConfig twilioApiConfig(
      TwilioConnectorProperties properties, @Qualifier("twilioConnectorClock") Clock clock) {
    String authToken =
        resolveOptionalSecret(
            properties.getAuthToken(),
            properties.getAuthTokenFile(),
            "connector.twilio.auth-token-file");
    return new TwilioApiConfig(
        URI.create(properties.getBaseUrl()),
        properties.getAccountSid(),
        authToken,
        Duration.ofMillis(properties.getTimeoutMs()),
        clock);
  }

  @Bean
  @ConditionalOnMissingBean(name = "twilioRestClient")
  public RestClient twilioRestClient(TwilioApiConfig config) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    int timeout =
        (int) Math.min(Integer.MAX_VALUE, Math.max(100L, config.timeout().toMillis()));
    requestFactory.setConnectTimeout(timeout);
    requestFactory.setReadTimeout(timeout);
    return RestClient.builder()
        .baseUrl(config.baseUri().toString())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public TwilioMessageParser twilioMessageParser(ObjectMapper objectMapper) {
    return new TwilioMessageParser(objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  public TwilioMessagingClient twilioMessagingClient(
      @Qualifier("twilioRestClient") RestClient twilioRestClient,
      TwilioMessageParser twilioMessageParser,
      TwilioApiConfig config) {
    return new RestTwilioMessagingClient(twilioRestClient, twilioMessageParser, config);
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryAfterParser retryAfterParser(@Qualifier("twilioConnectorClock") Clock clock) {
    return new RetryAfterParser(clock);
  }

  @Bean
  @ConditionalOnMissingBean(name = "twilioSubmitBackoff")
  public JitteredExponentialBackoff twilioSubmitBackoff(TwilioConnectorProperties properties) {
    TwilioConnectorProperties.Retry retry = properties.getRetry();
    return new JitteredExponentialBackoff(
        retry.getBaseBackoffMs(), retry.getMaxBackoffMs(), retry.isJitterEnabled());
  }

  @Bean
  @ConditionalOnMissingBean(name = "twilioPollBackoff")
  public JitteredExponentialBackoff twilioPollBackoff(TwilioConnectorProperties properties) {
    TwilioConnectorProperties.Polling polling = properties.getPolling();
    return new JitteredExponentialBackoff(
        polling.getBaseBackoffMs(), polling.getMaxBackoffMs(), false);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitRetryExecutor rateLimitRetryExecutor(
      RetryAfterParser retryAfterParser,
      @Qualifier("twilioSubmitBackoff") JitteredExponentialBackoff twilioSubmitBackoff,
      MeterRegistry meterRegistry) {
    return new RateLimitRetryExecutor(retryAfterParser, twilioSubmitBackoff, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliveryStatusPoller deliveryStatusPoller(
      TwilioMessagingClient twilioMessagingClient,
      @Qualifier("twilioPollBackoff") JitteredExponentialBackoff twilioPollBackoff,
      MeterRegistry meterRegistry) {
    return new DeliveryStatusPoller(
        twilioMessagingClient,
        twilioPollBackoff,
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  /** Submit retries after the first call, and status polls after acceptance. */
  @Bean
  @ConditionalOnMissingBean
  public DeliveryBudget deliveryBudget(TwilioConnectorProperties properties) {
    return new DeliveryBudget(
        properties.getRetry().getMaxRetries(), properties.getPolling().getMaxPolls());
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliveryPipeline deliveryPipeline(
      TwilioMessagingClient twilioMessagingClient,
      RateLimitRetryExecutor rateLimitRetryExecutor,
      DeliveryStatusPoller deliveryStatusPoller,
      DeliveryOutcomeStore deliveryOutcomeStore,
      DeliveryBudget budget,
      MeterRegistry meterRegistry,
      @Qualifier("twilioConnectorClock") Clock clock) {
    return new DeliveryPipeline(
        twilioMessagingClient,
        rateLimitRetryExecutor,
        deliveryStatusPoller,
        deliveryOutcomeStore,
        budget,
        meterRegistry,
        clock);
  }

  static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }
}
