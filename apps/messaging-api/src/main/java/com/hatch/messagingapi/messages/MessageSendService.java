package com.hatch.messagingapi.messages;

import com.hatch.domain.messages.DeliveryOutcome;
import com.hatch.domain.messages.MessageDomainException;
import com.hatch.domain.messages.OutboundMessage;
import com.hatch.integration.twilio.DeliveryPipeline;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Routes an outbound message. Phone-to-phone messages go through the carrier pipeline, which
 * persists the outcome itself; any other pair is stored directly as already sent.
 */
@Service
public class MessageSendService {
  private static final Logger log = LoggerFactory.getLogger(MessageSendService.class);

  static final String DIRECT_STATUS = "sent";
  static final String DIRECT_TYPE = "sms";

  private final MessageRepository messageRepository;
  private final ObjectProvider<DeliveryPipeline> deliveryPipelineProvider;
  private final Clock clock;

  @Autowired
  public MessageSendService(
      MessageRepository messageRepository,
      ObjectProvider<DeliveryPipeline> deliveryPipelineProvider) {
    this(messageRepository, deliveryPipelineProvider, Clock.systemUTC());
  }

  MessageSendService(
      MessageRepository messageRepository,
      ObjectProvider<DeliveryPipeline> deliveryPipelineProvider,
      Clock clock) {
    this.messageRepository = messageRepository;
    this.deliveryPipelineProvider = deliveryPipelineProvider;
    this.clock = clock;
  }

  public SendResult send(SendMessageCommand command) {
    String from = resolveSender(command);
    OutboundMessage message = new OutboundMessage(command.to(), from, command.content());
    if (command.conversationId() != null
        && !command.conversationId().equals(message.conversationId())) {
      throw new MessageDomainException(
          "conversation_id does not match the to/from pair: " + command.conversationId());
    }

    if (message.isPhoneToPhone()) {
      DeliveryPipeline pipeline = deliveryPipelineProvider.getIfAvailable();
      if (pipeline == null) {
        throw new CarrierUnavailableException("SMS delivery is not configured");
      }
      log.info("Sending message via carrier to={} from={}", message.to(), message.from());
      DeliveryOutcome outcome = pipeline.send(message);
      return new SendResult(
          outcome.messageId(),
          outcome.conversationId(),
          outcome.status(),
          SendResult.SendMethod.TWILIO);
    }

    StoredMessage stored =
        new StoredMessage(
            UUID.randomUUID(),
            message.to(),
            message.from(),
            message.body(),
            DIRECT_TYPE,
            clock.instant(),
            DIRECT_STATUS);
    messageRepository.insert(stored);
    log.info(
        "Stored message directly messageId={} conversationId={}",
        stored.id(),
        stored.conversationId());
    return new SendResult(
        stored.id(), stored.conversationId(), DIRECT_STATUS, SendResult.SendMethod.DATABASE);
  }

  private String resolveSender(SendMessageCommand command) {
    if (command.from() != null && !command.from().isBlank()) {
      return command.from();
    }
    if (command.conversationId() == null) {
      throw new MessageDomainException("from or conversation_id is required");
    }
    if (command.to() == null || command.to().isBlank()) {
      throw new MessageDomainException("to must not be blank");
    }
    return messageRepository
        .findParticipants(command.conversationId())
        .map(participants -> participants.counterpartOf(command.to()))
        .orElseThrow(() -> new ConversationNotFoundException(command.conversationId()));
  }
}
