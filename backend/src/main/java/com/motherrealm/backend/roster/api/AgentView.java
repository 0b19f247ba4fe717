package com.motherrealm.backend.roster.api;

import com.motherrealm.backend.roster.domain.AgentWorker;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Roster entry of a known agent, including its mirrored voice fields.")
public record AgentView(
    String name, String address, String type, String voiceId, boolean voiceEnabled) {

  public static AgentView from(AgentWorker worker) {
    return new AgentView(
        worker.getName(),
        worker.getAddress(),
        worker.getType(),
        worker.getVoiceId(),
        worker.isVoiceEnabled());
  }
}
