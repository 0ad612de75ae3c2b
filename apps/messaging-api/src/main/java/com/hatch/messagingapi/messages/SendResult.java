package com.hatch.messagingapi.messages;

import java.util.UUID;

public record SendResult(UUID messageId, UUID conversationId, String status, SendMethod method) {
  public enum SendMethod {
    TWILIO,
    SENDGRID,
    DATABASE
  }
}
