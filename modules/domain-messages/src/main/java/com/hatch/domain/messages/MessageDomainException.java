package com.hatch.domain.messages;

public class MessageDomainException extends RuntimeException {
  public MessageDomainException(String message) {
    super(message);
  }
}
