package com.motherrealm.backend.observer.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.roster.api.AgentView;
import java.time.Instant;
import java.util.List;

/**
 * A state transition pushed to every subscribed observer. Only the fields relevant for the
 * {@link #type()} are populated; the rest are omitted from the JSON frame.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObserverEvent(
    ObserverEventType type,
    String status,
    @JsonProperty("conversation_id") String conversationId,
    List<String> participants,
    @JsonProperty("isPrivate") Boolean isPrivate,
    List<AgentView> agents,
    String agent,
    String voiceId,
    JsonNode params,
    Boolean success,
    Boolean rosterMirrored,
    String error,
    String sender,
    String recipient,
    String content,
    String messageType,
    Long messageId,
    Instant timestamp) {

  public static final String STATUS_CREATED = "created";
  public static final String STATUS_ENDED = "ended";

  public static ObserverEvent rosterUpdate(List<AgentView> agents) {
    return new ObserverEvent(
        ObserverEventType.ROSTER_UPDATE,
        null, null, null, null,
        List.copyOf(agents),
        null, null, null, null, null, null, null, null, null, null, null,
        Instant.now());
  }

  public static ObserverEvent voiceUpdated(
      String agent, String voiceId, JsonNode params, boolean rosterMirrored) {
    return new ObserverEvent(
        ObserverEventType.VOICE_UPDATE,
        null, null, null, null, null,
        agent, voiceId, params, true, rosterMirrored, null,
        null, null, null, null, null,
        Instant.now());
  }

  public static ObserverEvent voiceFailed(String agent, String voiceId, String error) {
    return new ObserverEvent(
        ObserverEventType.VOICE_UPDATE,
        null, null, null, null, null,
        agent, voiceId, null, false, false, error,
        null, null, null, null, null,
        Instant.now());
  }

  public static ObserverEvent conversationCreated(
      String conversationId, List<String> participants, boolean isPrivate) {
    return new ObserverEvent(
        ObserverEventType.CONVERSATION_UPDATE,
        STATUS_CREATED, conversationId, List.copyOf(participants), isPrivate,
        null, null, null, null, null, null, null, null, null, null, null, null,
        Instant.now());
  }

  public static ObserverEvent conversationEnded(
      String conversationId, List<String> participants, boolean isPrivate) {
    return new ObserverEvent(
        ObserverEventType.CONVERSATION_UPDATE,
        STATUS_ENDED, conversationId, List.copyOf(participants), isPrivate,
        null, null, null, null, null, null, null, null, null, null, null, null,
        Instant.now());
  }

  public static ObserverEvent debugMessage(
      String conversationId,
      boolean isPrivate,
      long messageId,
      String sender,
      String content,
      String messageType) {
    return new ObserverEvent(
        ObserverEventType.DEBUG_MESSAGE,
        null, conversationId, null, isPrivate, null, null, null, null, null, null, null,
        sender, conversationId, content, messageType, messageId,
        Instant.now());
  }

  @JsonIgnore
  public boolean isConversationEnded() {
    return type == ObserverEventType.CONVERSATION_UPDATE && STATUS_ENDED.equals(status);
  }
}
