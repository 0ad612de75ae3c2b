package com.hatch.messagingapi.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hatch.messagingapi.messages.SendEmailCommand;
import jakarta.validation.constraints.NotBlank;

public record SendEmailRequest(
    @NotBlank String to,
    @NotBlank String from,
    @NotBlank String subject,
    String content,
    @JsonProperty("html_content") String htmlContent) {
  public SendEmailCommand toCommand() {
    return new SendEmailCommand(to, from, subject, content, htmlContent);
  }
}
