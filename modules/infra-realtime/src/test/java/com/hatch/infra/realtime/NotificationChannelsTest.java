package com.hatch.infra.realtime;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class NotificationChannelsTest {
  @Test
  void shouldMapKnownChannelsToKinds() {
    assertEquals(
        ChangeEventKind.MESSAGE_UPDATE, NotificationChannels.kindFor("message_changes"));
    assertEquals(
        ChangeEventKind.CONVERSATION_UPDATE, NotificationChannels.kindFor("conversation_changes"));
    assertEquals(ChangeEventKind.UNKNOWN, NotificationChannels.kindFor("other"));
    assertEquals(ChangeEventKind.UNKNOWN, NotificationChannels.kindFor(null));
  }

  @Test
  void shouldAcceptOnlyPlainIdentifiers() {
    for (String channel : NotificationChannels.defaults()) {
      assertDoesNotThrow(() -> NotificationChannels.assertValid(channel));
    }
    assertFalse(NotificationChannels.isValid("Message_Changes"));
    assertFalse(NotificationChannels.isValid("message_changes; DROP TABLE messages"));
    assertFalse(NotificationChannels.isValid(""));
    assertThrows(
        IllegalArgumentException.class, () -> NotificationChannels.assertValid("bad-channel"));
  }

  @Test
  void shouldValidateListenerConfig() {
    assertEquals(List.of("message_changes", "conversation_changes"),
        ChangeListenerConfig.defaults().channels());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ChangeListenerConfig(
                List.of(), Duration.ofMillis(100), Duration.ofMillis(250), Duration.ofSeconds(5)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ChangeListenerConfig(
                List.of("message_changes"),
                Duration.ofMillis(100),
                Duration.ZERO,
                Duration.ofSeconds(5)));
  }
}
