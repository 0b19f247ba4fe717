package com.motherrealm.backend.conversation.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.motherrealm.backend.conversation.domain.ConversationMessage;
import com.motherrealm.backend.conversation.domain.SenderKind;
import java.time.Instant;

public record MessageResponse(
    Long id,
    @JsonProperty("conversation_id") String conversationId,
    String sender,
    SenderKind senderKind,
    String content,
    String messageType,
    Instant timestamp) {

  public static MessageResponse from(ConversationMessage message) {
    return new MessageResponse(
        message.getId(),
        message.getConversation().getId(),
        message.getSender(),
        message.getSenderKind(),
        message.getContent(),
        message.getMessageType(),
        message.getCreatedAt());
  }
}
