package com.hatch.integration.twilio;

import com.hatch.domain.messages.OutboundMessage;
import com.hatch.integration.twilio.TwilioMessageParser.TwilioErrorPayload;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

public class RestTwilioMessagingClient implements TwilioMessagingClient {
  private static final String MESSAGES_PATH = "/Accounts/{accountSid}/Messages.json";
  private static final String MESSAGE_PATH = "/Accounts/{accountSid}/Messages/{messageSid}.json";

  private final RestClient restClient;
  private final TwilioMessageParser parser;
  private final TwilioApiConfig config;

  public RestTwilioMessagingClient(
      RestClient restClient, TwilioMessageParser parser, TwilioApiConfig config) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  @Override
  public CarrierResponse submit(OutboundMessage message) {
    Objects.requireNonNull(message, "message must not be null");
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("To", message.to());
    form.add("From", message.from());
    form.add("Body", message.body());
    try {
      ResponseEntity<String> response =
          restClient
              .post()
              .uri(MESSAGES_PATH, config.accountSid())
              .headers(headers -> headers.setBasicAuth(config.accountSid(), config.authToken()))
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .accept(MediaType.APPLICATION_JSON)
              .body(form)
              .retrieve()
              .onStatus(HttpStatusCode::isError, (request, result) -> raiseTwilioApiException(result))
              .toEntity(String.class);
      return toCarrierResponse(response);
    } catch (ResourceAccessException ex) {
      throw new TwilioConnectorException(
          "Failed Twilio submit_message request", TwilioConnectorException.IO_FAILURE_STATUS, ex);
    }
  }

  @Override
  public CarrierResponse fetchStatus(String messageSid) {
    if (messageSid == null || messageSid.isBlank()) {
      throw new IllegalArgumentException("messageSid must not be blank");
    }
    try {
      ResponseEntity<String> response =
          restClient
              .get()
              .uri(MESSAGE_PATH, config.accountSid(), messageSid)
              .headers(headers -> headers.setBasicAuth(config.accountSid(), config.authToken()))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, (request, result) -> raiseTwilioApiException(result))
              .toEntity(String.class);
      return toCarrierResponse(response);
    } catch (ResourceAccessException ex) {
      throw new TwilioConnectorException(
          "Failed Twilio fetch_message request", TwilioConnectorException.IO_FAILURE_STATUS, ex);
    }
  }

  private CarrierResponse toCarrierResponse(ResponseEntity<String> response) {
    return new CarrierResponse(
        response.getStatusCode().value(),
        parser.parseRecord(response.getBody()),
        CarrierResponseHeaders.from(response.getHeaders()));
  }

  private void raiseTwilioApiException(ClientHttpResponse response) throws IOException {
    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    TwilioErrorPayload error = parser.parseError(body);
    throw new TwilioApiException(
        response.getStatusCode().value(),
        response.getHeaders(),
        body,
        error.code(),
        error.message(),
        error.moreInfo());
  }
}
