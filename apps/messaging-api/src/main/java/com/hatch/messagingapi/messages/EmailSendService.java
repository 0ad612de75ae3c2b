package com.hatch.messagingapi.messages;

import com.hatch.domain.messages.OutboundEmail;
import com.hatch.integration.sendgrid.EmailDeliveryOutcome;
import com.hatch.integration.sendgrid.EmailDeliveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/** Sends email through SendGrid when the connector is enabled. */
@Service
public class EmailSendService {
  private static final Logger log = LoggerFactory.getLogger(EmailSendService.class);

  private final ObjectProvider<EmailDeliveryService> emailDeliveryServiceProvider;

  public EmailSendService(ObjectProvider<EmailDeliveryService> emailDeliveryServiceProvider) {
    this.emailDeliveryServiceProvider = emailDeliveryServiceProvider;
  }

  public SendResult send(SendEmailCommand command) {
    OutboundEmail email =
        new OutboundEmail(
            command.to(), command.from(), command.subject(), command.content(), command.htmlContent());
    EmailDeliveryService delivery = emailDeliveryServiceProvider.getIfAvailable();
    if (delivery == null) {
      throw new CarrierUnavailableException("Email delivery is not configured");
    }
    log.info("Sending email to={} from={} subject={}", email.to(), email.from(), email.subject());
    EmailDeliveryOutcome outcome = delivery.send(email);
    return new SendResult(
        outcome.messageId(),
        outcome.conversationId(),
        outcome.status(),
        SendResult.SendMethod.SENDGRID);
  }
}
