package com.motherrealm.backend.command.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CreateConversationCommand(
    String initiator, List<String> participants, @JsonProperty("isPrivate") boolean isPrivate)
    implements ObserverCommand {

  @Override
  public String commandType() {
    return CREATE_CONVERSATION;
  }
}
