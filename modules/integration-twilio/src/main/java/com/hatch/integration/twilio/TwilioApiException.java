package com.hatch.integration.twilio;

import java.util.Objects;
import java.util.Optional;
import org.springframework.http.HttpHeaders;

/** Non-2xx answer from the carrier API. */
public class TwilioApiException extends RuntimeException {
  static final int TOO_MANY_REQUESTS_CODE = 20429;

  private final int statusCode;
  private final HttpHeaders responseHeaders;
  private final String responseBody;
  private final Integer twilioCode;
  private final String twilioMessage;
  private final String moreInfo;

  public TwilioApiException(
      int statusCode,
      HttpHeaders responseHeaders,
      String responseBody,
      Integer twilioCode,
      String twilioMessage,
      String moreInfo) {
    super(
        "Twilio API error status="
            + statusCode
            + ", twilioCode="
            + twilioCode
            + ", message="
            + twilioMessage);
    this.statusCode = statusCode;
    this.responseHeaders =
        HttpHeaders.readOnlyHttpHeaders(
            responseHeaders == null ? HttpHeaders.EMPTY : responseHeaders);
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
    this.twilioCode = twilioCode;
    this.twilioMessage = twilioMessage;
    this.moreInfo = moreInfo;
  }

  public int statusCode() {
    return statusCode;
  }

  public HttpHeaders responseHeaders() {
    return responseHeaders;
  }

  public String responseBody() {
    return responseBody;
  }

  public Integer twilioCode() {
    return twilioCode;
  }

  public String twilioMessage() {
    return twilioMessage;
  }

  public String moreInfo() {
    return moreInfo;
  }

  public CarrierResponseHeaders carrierHeaders() {
    return CarrierResponseHeaders.from(responseHeaders);
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(responseHeaders.getFirst(HttpHeaders.RETRY_AFTER));
  }

  public boolean isRateLimitError() {
    return statusCode == 429 || Integer.valueOf(TOO_MANY_REQUESTS_CODE).equals(twilioCode);
  }
}
