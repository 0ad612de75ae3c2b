package com.hatch.infra.realtime;

public class ChangeEventParseException extends RuntimeException {
  private final String channel;

  public ChangeEventParseException(String channel, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
  }

  public String channel() {
    return channel;
  }
}
