package com.motherrealm.backend.command.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SendMessageCommand(
    @JsonProperty("conversation_id") String conversationId,
    String sender,
    String content,
    String messageType)
    implements ObserverCommand {

  @Override
  public String commandType() {
    return SEND_MESSAGE;
  }
}
