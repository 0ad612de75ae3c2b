package com.hatch.infra.realtime;

import java.util.List;
import java.util.regex.Pattern;

public final class NotificationChannels {
  public static final String MESSAGE_CHANGES = "message_changes";
  public static final String CONVERSATION_CHANGES = "conversation_changes";

  private static final Pattern CHANNEL_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

  private NotificationChannels() {}

  public static List<String> defaults() {
    return List.of(MESSAGE_CHANGES, CONVERSATION_CHANGES);
  }

  public static ChangeEventKind kindFor(String channel) {
    if (MESSAGE_CHANGES.equals(channel)) {
      return ChangeEventKind.MESSAGE_UPDATE;
    }
    if (CONVERSATION_CHANGES.equals(channel)) {
      return ChangeEventKind.CONVERSATION_UPDATE;
    }
    return ChangeEventKind.UNKNOWN;
  }

  // Channel names are interpolated into LISTEN statements, so only plain identifiers pass.
  public static void assertValid(String channel) {
    if (!isValid(channel)) {
      throw new IllegalArgumentException("Invalid notification channel: " + channel);
    }
  }

  public static boolean isValid(String channel) {
    return channel != null && CHANNEL_PATTERN.matcher(channel).matches();
  }
}
