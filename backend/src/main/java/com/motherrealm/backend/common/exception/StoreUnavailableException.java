package com.motherrealm.backend.common.exception;

public class StoreUnavailableException extends OrchestrationException {

  public StoreUnavailableException(String operation, Throwable cause) {
    super(ErrorCode.STORE_UNAVAILABLE, "Persistence store unavailable during " + operation, cause);
  }
}
