package com.motherrealm.backend.common.exception;

public class InvalidParticipantsException extends OrchestrationException {

  public InvalidParticipantsException(int distinctParticipants) {
    super(
        ErrorCode.INVALID_PARTICIPANTS,
        "A conversation needs at least two distinct participants, got " + distinctParticipants);
  }
}
