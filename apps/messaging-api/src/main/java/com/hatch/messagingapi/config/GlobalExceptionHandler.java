package com.hatch.messagingapi.config;

import com.hatch.domain.messages.MessageDomainException;
import com.hatch.integration.sendgrid.EmailDeliveryFailedException;
import com.hatch.integration.twilio.DeliveryFailedException;
import com.hatch.integration.twilio.TwilioApiException;
import com.hatch.integration.twilio.TwilioConnectorException;
import com.hatch.messagingapi.messages.CarrierUnavailableException;
import com.hatch.messagingapi.messages.ConversationNotFoundException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
    problem.setType(URI.create(TYPE_PREFIX + "validation-error"));
    problem.setTitle("Validation Error");
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(
                fe ->
                    new FieldError(
                        fe.getField(),
                        fe.getDefaultMessage(),
                        String.valueOf(fe.getRejectedValue())))
            .toList());
    return problem;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request body is not readable");
    problem.setType(URI.create(TYPE_PREFIX + "malformed-request"));
    problem.setTitle("Malformed Request");
    return problem;
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParam(MissingServletRequestParameterException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "missing-parameter"));
    problem.setTitle("Missing Parameter");
    return problem;
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String detail =
        String.format(
            "Parameter '%s' should be of type '%s'",
            ex.getName(),
            ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setType(URI.create(TYPE_PREFIX + "type-mismatch"));
    problem.setTitle("Type Mismatch");
    return problem;
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "method-not-allowed"));
    problem.setTitle("Method Not Allowed");
    return problem;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNotFound(NoResourceFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(ConversationNotFoundException.class)
  public ProblemDetail handleConversationNotFound(ConversationNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "conversation-not-found"));
    problem.setTitle("Conversation Not Found");
    problem.setProperty("conversationId", ex.conversationId());
    return problem;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "invalid-argument"));
    problem.setTitle("Invalid Argument");
    return problem;
  }

  @ExceptionHandler(MessageDomainException.class)
  public ProblemDetail handleMessageDomain(MessageDomainException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "message-domain-error"));
    problem.setTitle("Message Validation Error");
    return problem;
  }

  @ExceptionHandler(CarrierUnavailableException.class)
  public ProblemDetail handleCarrierUnavailable(CarrierUnavailableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "carrier-unavailable"));
    problem.setTitle("Carrier Unavailable");
    return problem;
  }

  @ExceptionHandler(DeliveryFailedException.class)
  public ProblemDetail handleDeliveryFailed(DeliveryFailedException ex) {
    log.warn(
        "Delivery failed messageId={} phase={} retryCount={}",
        ex.outcome().messageId(),
        ex.outcome().phase(),
        ex.outcome().retryCount());
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "delivery-failed"));
    problem.setTitle("Delivery Failed");
    problem.setProperty("messageId", ex.outcome().messageId());
    problem.setProperty("status", ex.outcome().status());
    problem.setProperty("retryCount", ex.outcome().retryCount());
    return problem;
  }

  @ExceptionHandler(EmailDeliveryFailedException.class)
  public ProblemDetail handleEmailDeliveryFailed(EmailDeliveryFailedException ex) {
    log.warn(
        "Email delivery failed messageId={} providerStatus={}",
        ex.outcome().messageId(),
        ex.outcome().providerStatus());
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "email-delivery-failed"));
    problem.setTitle("Email Delivery Failed");
    problem.setProperty("messageId", ex.outcome().messageId());
    problem.setProperty("status", ex.outcome().status());
    problem.setProperty("providerStatus", ex.outcome().providerStatus());
    return problem;
  }

  @ExceptionHandler(TwilioApiException.class)
  public ProblemDetail handleCarrierRejection(TwilioApiException ex) {
    log.warn(
        "Carrier rejected request statusCode={} twilioCode={} message={}",
        ex.statusCode(),
        ex.twilioCode(),
        ex.twilioMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, "Carrier rejected the request");
    problem.setType(URI.create(TYPE_PREFIX + "carrier-error"));
    problem.setTitle("Carrier Error");
    problem.setProperty("carrierStatus", ex.statusCode());
    problem.setProperty("carrierCode", ex.twilioCode());
    problem.setProperty("carrierMessage", ex.twilioMessage());
    return problem;
  }

  @ExceptionHandler(TwilioConnectorException.class)
  public ProblemDetail handleCarrierTransport(TwilioConnectorException ex) {
    log.warn("Carrier request failed reason={}", ex.getMessage(), ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, "Carrier could not be reached");
    problem.setType(URI.create(TYPE_PREFIX + "carrier-unreachable"));
    problem.setTitle("Carrier Unreachable");
    return problem;
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.");
    problem.setType(URI.create(TYPE_PREFIX + "internal-error"));
    problem.setTitle("Internal Server Error");
    return problem;
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}
