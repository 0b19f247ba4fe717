package com.motherrealm.backend.observer.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ObserverEventType {
  ROSTER_UPDATE("roster_update", EventPriority.STANDARD),
  VOICE_UPDATE("voice_update", EventPriority.STANDARD),
  CONVERSATION_UPDATE("conversation_update", EventPriority.CRITICAL),
  DEBUG_MESSAGE("debug_message", EventPriority.BULK);

  private final String wireName;
  private final EventPriority priority;

  ObserverEventType(String wireName, EventPriority priority) {
    this.wireName = wireName;
    this.priority = priority;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public EventPriority priority() {
    return priority;
  }

  @JsonCreator
  public static ObserverEventType fromWireName(String value) {
    for (ObserverEventType type : values()) {
      if (type.wireName.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown observer event type: " + value);
  }

  /**
   * Eviction order for a full subscriber queue. Lower ordinal survives longer; delivery order is
   * always arrival order.
   */
  public enum EventPriority {
    CRITICAL,
    STANDARD,
    BULK
  }
}
