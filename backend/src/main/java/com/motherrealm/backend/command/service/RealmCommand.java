package com.motherrealm.backend.command.service;

import java.util.List;

public record RealmCommand(String action, List<String> arguments) {

  public RealmCommand {
    arguments = arguments != null ? List.copyOf(arguments) : List.of();
  }
}
