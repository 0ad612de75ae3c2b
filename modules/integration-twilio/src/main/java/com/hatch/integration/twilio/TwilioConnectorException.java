package com.hatch.integration.twilio;

/** The carrier could not be reached or its answer could not be read. */
public class TwilioConnectorException extends RuntimeException {
  public static final int IO_FAILURE_STATUS = -1;

  private final int httpStatus;

  public TwilioConnectorException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }

  public TwilioConnectorException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
