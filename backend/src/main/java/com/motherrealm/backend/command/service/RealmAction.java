package com.motherrealm.backend.command.service;

import java.util.Arrays;
import java.util.Optional;

public enum RealmAction {
  /** Opens a private conversation among the listed agents, hidden from non-debug observers. */
  PRIVATE_CHAT("debugwindowoutONLYLLMONLYPRIVATECHAT");

  private final String commandName;

  RealmAction(String commandName) {
    this.commandName = commandName;
  }

  public String commandName() {
    return commandName;
  }

  public static Optional<RealmAction> fromCommandName(String name) {
    return Arrays.stream(values()).filter(action -> action.commandName.equals(name)).findFirst();
  }
}
