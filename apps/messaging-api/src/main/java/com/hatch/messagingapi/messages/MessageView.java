package com.hatch.messagingapi.messages;

import java.time.Instant;
import java.util.UUID;

public record MessageView(
    UUID id,
    UUID conversationId,
    String toContact,
    String fromContact,
    String body,
    String type,
    Instant timestamp,
    String status,
    String externalSid,
    String direction,
    Integer errorCode,
    String errorMessage) {}
