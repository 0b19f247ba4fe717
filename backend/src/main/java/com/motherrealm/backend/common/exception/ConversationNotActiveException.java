package com.motherrealm.backend.common.exception;

public class ConversationNotActiveException extends OrchestrationException {

  public ConversationNotActiveException(String conversationId) {
    super(
        ErrorCode.CONVERSATION_NOT_ACTIVE,
        "Conversation " + conversationId + " does not exist or has already ended");
  }
}
