package com.hatch.infra.realtime;

public enum ChangeEventKind {
  MESSAGE_UPDATE("message_update"),
  CONVERSATION_UPDATE("conversation_update"),
  UNKNOWN("unknown");

  private final String wireName;

  ChangeEventKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
