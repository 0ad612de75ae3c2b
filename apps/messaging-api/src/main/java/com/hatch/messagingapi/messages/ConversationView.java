package com.hatch.messagingapi.messages;

import java.time.Instant;
import java.util.UUID;

/** One conversation row; {@code participants} is the comma-joined contact pair. */
public record ConversationView(
    UUID conversationId, String participants, Instant lastMessageDate, long messageCount) {}
