package com.motherrealm.backend.command.api;

public record RealmPromptCommand(String sender, String prompt) implements ObserverCommand {

  @Override
  public String commandType() {
    return REALM_COMMAND;
  }
}
