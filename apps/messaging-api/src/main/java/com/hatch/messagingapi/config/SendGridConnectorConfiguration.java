package com.hatch.messagingapi.config;

import com.hatch.integration.sendgrid.EmailDeliveryService;
import com.hatch.integration.sendgrid.EmailOutcomeStore;
import com.hatch.integration.sendgrid.SendGridConnectorProperties;
import com.sendgrid.SendGrid;
import com.sendgrid.SendGridAPI;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SendGridConnectorProperties.class)
@ConditionalOnProperty(prefix = "connector.sendgrid", name = "enabled", havingValue = "true")
public class SendGridConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "sendGridConnectorClock")
  public Clock sendGridConnectorClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public SendGridAPI sendGridApi(SendGridConnectorProperties properties) {
    String apiKey =
        TwilioConnectorConfiguration.resolveOptionalSecret(
            properties.getApiKey(), properties.getApiKeyFile(), "connector.sendgrid.api-key-file");
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException(
          "connector.sendgrid.api-key is required when the SendGrid connector is enabled");
    }
    SendGrid sendGrid = new SendGrid(apiKey);
    if (properties.getHost() != null && !properties.getHost().isBlank()) {
      sendGrid.setHost(properties.getHost());
    }
    return sendGrid;
  }

  @Bean
  @ConditionalOnMissingBean
  public EmailDeliveryService emailDeliveryService(
      SendGridAPI sendGridApi,
      EmailOutcomeStore emailOutcomeStore,
      MeterRegistry meterRegistry,
      @Qualifier("sendGridConnectorClock") Clock clock) {
    return new EmailDeliveryService(sendGridApi, emailOutcomeStore, meterRegistry, clock);
  }
}
