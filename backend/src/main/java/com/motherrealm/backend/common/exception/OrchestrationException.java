package com.motherrealm.backend.common.exception;

import org.springframework.web.server.ResponseStatusException;

/**
 * Base type for failures reported to observers and REST callers. Each subclass maps to exactly
 * one {@link ErrorCode}; the HTTP status is derived from the code.
 */
public abstract class OrchestrationException extends ResponseStatusException {

  private final ErrorCode errorCode;

  protected OrchestrationException(ErrorCode errorCode, String reason) {
    super(errorCode.status(), reason);
    this.errorCode = errorCode;
  }

  protected OrchestrationException(ErrorCode errorCode, String reason, Throwable cause) {
    super(errorCode.status(), reason, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}
