package com.motherrealm.backend.conversation.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.motherrealm.backend.conversation.domain.Conversation;
import java.time.Instant;
import java.util.List;

public record ConversationSummary(
    @JsonProperty("conversation_id") String conversationId,
    String initiator,
    List<String> participants,
    @JsonProperty("isPrivate") boolean isPrivate,
    boolean active,
    long messageCount,
    Instant createdAt,
    Instant lastActivityAt,
    Instant endedAt) {

  public static ConversationSummary from(Conversation conversation, long messageCount) {
    return new ConversationSummary(
        conversation.getId(),
        conversation.getInitiatorId(),
        conversation.getParticipants(),
        conversation.isPrivate(),
        conversation.isActive(),
        messageCount,
        conversation.getCreatedAt(),
        conversation.getLastActivityAt(),
        conversation.getEndedAt());
  }
}
