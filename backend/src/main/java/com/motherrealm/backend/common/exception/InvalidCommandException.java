package com.motherrealm.backend.common.exception;

public class InvalidCommandException extends OrchestrationException {

  public InvalidCommandException(String reason) {
    super(ErrorCode.INVALID_COMMAND, reason);
  }
}
