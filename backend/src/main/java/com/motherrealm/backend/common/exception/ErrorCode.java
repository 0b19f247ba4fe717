package com.motherrealm.backend.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
  INVALID_PARTICIPANTS(HttpStatus.BAD_REQUEST),
  INVALID_COMMAND(HttpStatus.BAD_REQUEST),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  CONVERSATION_NOT_ACTIVE(HttpStatus.CONFLICT),
  ALREADY_ENDED(HttpStatus.CONFLICT),
  STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
  INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus status;

  ErrorCode(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
