package com.hatch.infra.realtime;

import java.util.Locale;

public enum ChangeAction {
  INSERT,
  UPDATE,
  DELETE;

  public String wireName() {
    return name();
  }

  /** Returns null for a missing or unrecognized action. */
  public static ChangeAction fromWire(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (ChangeAction action : values()) {
      if (action.name().equals(normalized)) {
        return action;
      }
    }
    return null;
  }
}
