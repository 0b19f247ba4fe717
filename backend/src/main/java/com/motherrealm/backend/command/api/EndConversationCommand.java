package com.motherrealm.backend.command.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EndConversationCommand(@JsonProperty("conversation_id") String conversationId)
    implements ObserverCommand {

  @Override
  public String commandType() {
    return END_CONVERSATION;
  }
}
