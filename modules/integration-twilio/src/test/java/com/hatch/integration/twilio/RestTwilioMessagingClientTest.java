package com.hatch.integration.twilio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

class RestTwilioMessagingClientTest {
  private static final String BASE_URL = "https://twilio.test/2010-04-01";
  private static final String AUTH_TOKEN = "test-token";

  private MockRestServiceServer server;
  private RestTwilioMessagingClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    client =
        new RestTwilioMessagingClient(
            builder.build(),
            new TwilioMessageParser(new ObjectMapper()),
            new TwilioApiConfig(
                URI.create(BASE_URL),
                TwilioFixtures.ACCOUNT_SID,
                AUTH_TOKEN,
                Duration.ofSeconds(5),
                Clock.systemUTC()));
  }

  @Test
  void shouldSubmitFormEncodedMessageWithBasicAuth() {
    MultiValueMap<String, String> expectedForm = new LinkedMultiValueMap<>();
    expectedForm.add("To", "+15550002222");
    expectedForm.add("From", "+15550001111");
    expectedForm.add("Body", "Your table is ready");
    HttpHeaders responseHeaders = new HttpHeaders();
    responseHeaders.add("Twilio-Request-Id", "RQ123");
    responseHeaders.add("Twilio-Concurrent-Requests", "1");
    responseHeaders.add("Twilio-Request-Duration", "0.042");

    server
        .expect(requestTo(BASE_URL + "/Accounts/" + TwilioFixtures.ACCOUNT_SID + "/Messages.json"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, expectedBasicAuth()))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(content().formData(expectedForm))
        .andRespond(
            withStatus(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(responseHeaders)
                .body(TwilioFixtures.messageJson("SM100", "queued")));

    CarrierResponse response = client.submit(TwilioFixtures.MESSAGE);

    assertEquals(201, response.statusCode());
    assertEquals("SM100", response.record().sid());
    assertEquals("queued", response.record().status());
    assertEquals("RQ123", response.headers().requestId());
    assertEquals(1, response.headers().concurrentRequests());
    assertEquals(new BigDecimal("0.042"), response.headers().requestDurationSeconds());
    server.verify();
  }

  @Test
  void shouldRaiseRateLimitErrorWithCarrierDetails() {
    HttpHeaders headers = new HttpHeaders();
    headers.add(HttpHeaders.RETRY_AFTER, "2");
    server
        .expect(requestTo(BASE_URL + "/Accounts/" + TwilioFixtures.ACCOUNT_SID + "/Messages.json"))
        .andRespond(
            withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers)
                .body(TwilioFixtures.rateLimitJson()));

    TwilioApiException ex =
        assertThrows(TwilioApiException.class, () -> client.submit(TwilioFixtures.MESSAGE));

    assertTrue(ex.isRateLimitError());
    assertEquals(429, ex.statusCode());
    assertEquals(20429, ex.twilioCode());
    assertEquals("Too Many Requests", ex.twilioMessage());
    assertEquals("https://www.twilio.com/docs/errors/20429", ex.moreInfo());
    assertEquals("2", ex.retryAfterHeader().orElseThrow());
  }

  @Test
  void shouldRaiseHardErrorForRejectedSubmission() {
    server
        .expect(requestTo(BASE_URL + "/Accounts/" + TwilioFixtures.ACCOUNT_SID + "/Messages.json"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    """
                    {"code": 21211, "message": "The 'To' number is not a valid phone number.",
                     "more_info": "https://www.twilio.com/docs/errors/21211", "status": 400}
                    """));

    TwilioApiException ex =
        assertThrows(TwilioApiException.class, () -> client.submit(TwilioFixtures.MESSAGE));

    assertEquals(400, ex.statusCode());
    assertEquals(21211, ex.twilioCode());
    assertEquals(false, ex.isRateLimitError());
  }

  @Test
  void shouldFetchMessageStatusBySid() {
    server
        .expect(
            requestTo(
                BASE_URL + "/Accounts/" + TwilioFixtures.ACCOUNT_SID + "/Messages/SM100.json"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header(HttpHeaders.AUTHORIZATION, expectedBasicAuth()))
        .andRespond(
            withSuccess(TwilioFixtures.messageJson("SM100", "delivered"), MediaType.APPLICATION_JSON));

    CarrierResponse response = client.fetchStatus("SM100");

    assertEquals(200, response.statusCode());
    assertEquals("delivered", response.record().status());
    server.verify();
  }

  @Test
  void shouldWrapIoFailuresAsConnectorException() {
    server
        .expect(
            requestTo(
                BASE_URL + "/Accounts/" + TwilioFixtures.ACCOUNT_SID + "/Messages/SM100.json"))
        .andRespond(withException(new SocketTimeoutException("Read timed out")));

    TwilioConnectorException ex =
        assertThrows(TwilioConnectorException.class, () -> client.fetchStatus("SM100"));

    assertEquals(TwilioConnectorException.IO_FAILURE_STATUS, ex.httpStatus());
    assertTrue(ex.getCause().getCause() instanceof IOException);
  }

  private static String expectedBasicAuth() {
    String credentials = TwilioFixtures.ACCOUNT_SID + ":" + AUTH_TOKEN;
    return "Basic "
        + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.ISO_8859_1));
  }
}
