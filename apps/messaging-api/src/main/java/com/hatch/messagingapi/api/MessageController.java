package com.hatch.messagingapi.api;

import com.hatch.messagingapi.messages.EmailSendService;
import com.hatch.messagingapi.messages.MessageSendService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class MessageController {
  private final MessageSendService messageSendService;
  private final EmailSendService emailSendService;

  public MessageController(
      MessageSendService messageSendService, EmailSendService emailSendService) {
    this.messageSendService = messageSendService;
    this.emailSendService = emailSendService;
  }

  @PostMapping("/send_message")
  public ResponseEntity<SendMessageResponse> sendMessage(
      @Valid @RequestBody SendMessageRequest request) {
    return ResponseEntity.ok(
        SendMessageResponse.from(messageSendService.send(request.toCommand())));
  }

  @PostMapping("/send_email")
  public ResponseEntity<SendMessageResponse> sendEmail(
      @Valid @RequestBody SendEmailRequest request) {
    return ResponseEntity.ok(SendMessageResponse.from(emailSendService.send(request.toCommand())));
  }
}
