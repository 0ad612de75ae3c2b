package com.hatch.integration.sendgrid;

import com.hatch.domain.messages.OutboundEmail;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGridAPI;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one email through SendGrid and persists exactly one outcome for it, whether SendGrid
 * accepted the mail or not.
 */
public class EmailDeliveryService {
  private static final Logger log = LoggerFactory.getLogger(EmailDeliveryService.class);

  static final String MAIL_SEND_ENDPOINT = "mail/send";
  static final String MESSAGE_ID_HEADER = "X-Message-Id";
  static final String OUTCOME_COUNTER = "email.delivery.outcome.total";
  static final int NO_RESPONSE_STATUS = 500;

  private final SendGridAPI sendGrid;
  private final EmailOutcomeStore outcomeStore;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public EmailDeliveryService(
      SendGridAPI sendGrid,
      EmailOutcomeStore outcomeStore,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.sendGrid = Objects.requireNonNull(sendGrid, "sendGrid must not be null");
    this.outcomeStore = Objects.requireNonNull(outcomeStore, "outcomeStore must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public EmailDeliveryOutcome send(OutboundEmail email) {
    UUID messageId = UUID.randomUUID();
    log.info(
        "Submitting email messageId={} conversationId={} to={}",
        messageId,
        email.conversationId(),
        email.to());

    Response response;
    try {
      response = sendGrid.api(mailSendRequest(email));
    } catch (IOException ex) {
      log.error("SendGrid request failed messageId={} reason={}", messageId, ex.getMessage());
      EmailDeliveryOutcome outcome =
          complete(
              messageId,
              email,
              EmailDeliveryOutcome.FAILED,
              NO_RESPONSE_STATUS,
              null,
              ex.getMessage());
      throw new EmailDeliveryFailedException("SendGrid did not accept the email", outcome, ex);
    }

    int statusCode = response.getStatusCode();
    String providerMessageId = header(response.getHeaders(), MESSAGE_ID_HEADER);
    if (statusCode < 200 || statusCode >= 300) {
      log.error(
          "SendGrid rejected email messageId={} status={} body={}",
          messageId,
          statusCode,
          response.getBody());
      EmailDeliveryOutcome outcome =
          complete(
              messageId,
              email,
              EmailDeliveryOutcome.FAILED,
              statusCode,
              providerMessageId,
              response.getBody());
      throw new EmailDeliveryFailedException(
          "SendGrid rejected the email with status " + statusCode, outcome, null);
    }
    return complete(
        messageId, email, EmailDeliveryOutcome.SENT, statusCode, providerMessageId, null);
  }

  static Request mailSendRequest(OutboundEmail email) throws IOException {
    Mail mail =
        new Mail(new Email(email.from()), email.subject(), new Email(email.to()), content(email));
    Request request = new Request();
    request.setMethod(Method.POST);
    request.setEndpoint(MAIL_SEND_ENDPOINT);
    request.setBody(mail.build());
    return request;
  }

  private static Content content(OutboundEmail email) {
    if (email.hasHtml()) {
      return new Content("text/html", email.htmlContent());
    }
    return new Content("text/plain", email.storedBody());
  }

  private static String header(Map<String, String> headers, String name) {
    if (headers == null) {
      return null;
    }
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }

  private EmailDeliveryOutcome complete(
      UUID messageId,
      OutboundEmail email,
      String status,
      int providerStatus,
      String providerMessageId,
      String errorMessage) {
    EmailDeliveryOutcome outcome =
        new EmailDeliveryOutcome(
            messageId,
            email,
            status,
            providerStatus,
            providerMessageId,
            errorMessage,
            clock.instant());
    outcomeStore.saveEmailOutcome(outcome);
    meterRegistry.counter(OUTCOME_COUNTER, "status", status).increment();
    log.info(
        "Email finished messageId={} status={} providerStatus={} providerMessageId={}",
        messageId,
        status,
        providerStatus,
        providerMessageId);
    return outcome;
  }
}
