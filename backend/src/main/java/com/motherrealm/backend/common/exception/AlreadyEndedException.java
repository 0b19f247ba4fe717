package com.motherrealm.backend.common.exception;

public class AlreadyEndedException extends OrchestrationException {

  public AlreadyEndedException(String conversationId) {
    super(ErrorCode.ALREADY_ENDED, "Conversation " + conversationId + " has already ended");
  }
}
