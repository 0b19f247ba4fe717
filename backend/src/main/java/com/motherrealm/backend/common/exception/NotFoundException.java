package com.motherrealm.backend.common.exception;

public class NotFoundException extends OrchestrationException {

  public NotFoundException(String kind, String reference) {
    super(ErrorCode.NOT_FOUND, kind + " not found: " + reference);
  }

  public static NotFoundException conversation(String conversationId) {
    return new NotFoundException("Conversation", conversationId);
  }

  public static NotFoundException agent(String agentName) {
    return new NotFoundException("Agent", agentName);
  }
}
