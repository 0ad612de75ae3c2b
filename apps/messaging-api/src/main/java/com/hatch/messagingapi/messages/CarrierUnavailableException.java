package com.hatch.messagingapi.messages;

/** Raised when a send needs a provider connector that is disabled. */
public class CarrierUnavailableException extends RuntimeException {
  public CarrierUnavailableException(String message) {
    super(message);
  }
}
