package com.hatch.messagingapi.messages;

public record SendEmailCommand(
    String to, String from, String subject, String content, String htmlContent) {}
