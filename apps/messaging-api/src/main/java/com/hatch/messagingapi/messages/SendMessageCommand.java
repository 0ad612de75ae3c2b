package com.hatch.messagingapi.messages;

import java.util.UUID;

/** {@code from} may be omitted when {@code conversationId} names an existing conversation. */
public record SendMessageCommand(UUID conversationId, String to, String from, String content) {}
