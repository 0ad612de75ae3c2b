package com.hatch.domain.messages;

import java.util.UUID;

/** An email to send. When both bodies are given the HTML one is delivered. */
public record OutboundEmail(
    String to, String from, String subject, String textContent, String htmlContent) {
  static final String EMPTY_BODY = "No content provided";

  public OutboundEmail {
    requireAddress(to, "to");
    requireAddress(from, "from");
    if (subject == null || subject.isBlank()) {
      throw new MessageDomainException("subject must not be blank");
    }
  }

  public UUID conversationId() {
    return ConversationIds.derive(to, from);
  }

  public boolean hasHtml() {
    return htmlContent != null && !htmlContent.isBlank();
  }

  /** The body stored with the message: the plain text, falling back to the HTML. */
  public String storedBody() {
    if (textContent != null && !textContent.isBlank()) {
      return textContent;
    }
    return hasHtml() ? htmlContent : EMPTY_BODY;
  }

  public static boolean isEmailAddress(String contact) {
    if (contact == null) {
      return false;
    }
    int at = contact.indexOf('@');
    return at > 0 && at == contact.lastIndexOf('@') && at < contact.length() - 1;
  }

  private static void requireAddress(String value, String fieldName) {
    if (!isEmailAddress(value)) {
      throw new MessageDomainException(fieldName + " must be an email address");
    }
  }
}
