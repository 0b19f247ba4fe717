package com.motherrealm.backend.command.api;

import com.fasterxml.jackson.databind.JsonNode;

public record SetVoiceCommand(String agent, String voiceId, JsonNode params)
    implements ObserverCommand {

  @Override
  public String commandType() {
    return SET_VOICE;
  }
}
