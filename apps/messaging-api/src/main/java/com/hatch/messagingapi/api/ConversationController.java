package com.hatch.messagingapi.api;

import com.hatch.messagingapi.messages.MessageQueryService;
import java.time.Instant;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ConversationController {
  private final MessageQueryService messageQueryService;

  public ConversationController(MessageQueryService messageQueryService) {
    this.messageQueryService = messageQueryService;
  }

  @GetMapping("/conversations")
  public ConversationsResponse listConversations() {
    return new ConversationsResponse(
        messageQueryService.listConversations().stream().map(ConversationResponse::from).toList());
  }

  @GetMapping("/conversation/{conversationId}/messages")
  public MessagesResponse listMessages(@PathVariable("conversationId") UUID conversationId) {
    return new MessagesResponse(
        messageQueryService.listMessages(conversationId).stream()
            .map(MessageResponse::from)
            .toList());
  }

  @GetMapping("/conversation/{conversationId}/new_messages")
  public MessagesResponse listNewMessages(
      @PathVariable("conversationId") UUID conversationId,
      @RequestParam("since") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
    return new MessagesResponse(
        messageQueryService.listMessagesSince(conversationId, since).stream()
            .map(MessageResponse::from)
            .toList());
  }
}
