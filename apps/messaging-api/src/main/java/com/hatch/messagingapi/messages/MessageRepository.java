package com.hatch.messagingapi.messages;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository {
  void insert(StoredMessage message);

  List<ConversationView> findConversations();

  List<MessageView> findByConversationId(UUID conversationId);

  List<MessageView> findByConversationIdSince(UUID conversationId, Instant since);

  Optional<ConversationParticipants> findParticipants(UUID conversationId);
}
