package com.hatch.messagingapi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.hatch.domain.messages.ConversationIds;
import com.hatch.testsupport.containers.PostgresContainerBaseIT;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext
class MessagingApiApplicationIT extends PostgresContainerBaseIT {
  @Autowired private TestRestTemplate restTemplate;

  @Test
  void shouldReportHealthy() {
    ResponseEntity<JsonNode> response = restTemplate.getForEntity("/health", JsonNode.class);

    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertEquals("UP", response.getBody().get("status").asText());
  }

  @Test
  void shouldStoreMessageBetweenNamedContactsAndListIt() {
    Map<String, Object> request =
        Map.of("to", "Marta Ruiz", "from", "Front Desk", "content", "Your table is ready");

    ResponseEntity<JsonNode> sent =
        restTemplate.postForEntity("/api/send_message", request, JsonNode.class);

    assertEquals(HttpStatus.OK, sent.getStatusCode());
    JsonNode body = sent.getBody();
    UUID conversationId = ConversationIds.derive("Marta Ruiz", "Front Desk");
    assertTrue(body.get("success").asBoolean());
    assertEquals("database", body.get("method").asText());
    assertEquals(conversationId.toString(), body.get("conversation_id").asText());

    ResponseEntity<JsonNode> conversations =
        restTemplate.getForEntity("/api/conversations", JsonNode.class);
    assertEquals(HttpStatus.OK, conversations.getStatusCode());
    JsonNode summary = findConversation(conversations.getBody(), conversationId);
    assertEquals(1, summary.get("message_count").asLong());
    assertFalse(summary.get("has_phone_numbers").asBoolean());

    ResponseEntity<JsonNode> messages =
        restTemplate.getForEntity(
            "/api/conversation/{id}/messages", JsonNode.class, conversationId);
    assertEquals(HttpStatus.OK, messages.getStatusCode());
    JsonNode stored = messages.getBody().get("messages");
    assertEquals(1, stored.size());
    assertEquals("Your table is ready", stored.get(0).get("body").asText());
    assertEquals(body.get("message_id").asText(), stored.get(0).get("id").asText());
  }

  @Test
  void shouldRejectPhoneToPhoneSendWhileCarrierIsDisabled() {
    Map<String, Object> request =
        Map.of("to", "+15550001111", "from", "+15550002222", "content", "hello");

    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity("/api/send_message", request, JsonNode.class);

    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
  }

  private static JsonNode findConversation(JsonNode body, UUID conversationId) {
    for (JsonNode conversation : body.get("conversations")) {
      if (conversationId.toString().equals(conversation.get("conversation_id").asText())) {
        return conversation;
      }
    }
    throw new AssertionError("conversation " + conversationId + " not listed");
  }
}
