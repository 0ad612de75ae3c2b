package com.hatch.messagingapi.messages;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MessageQueryService {
  private final MessageRepository messageRepository;

  public MessageQueryService(MessageRepository messageRepository) {
    this.messageRepository = messageRepository;
  }

  @Transactional(readOnly = true)
  public List<ConversationView> listConversations() {
    return messageRepository.findConversations();
  }

  @Transactional(readOnly = true)
  public List<MessageView> listMessages(UUID conversationId) {
    return messageRepository.findByConversationId(conversationId);
  }

  @Transactional(readOnly = true)
  public List<MessageView> listMessagesSince(UUID conversationId, Instant since) {
    if (since == null) {
      throw new IllegalArgumentException("since is required");
    }
    return messageRepository.findByConversationIdSince(conversationId, since);
  }
}
