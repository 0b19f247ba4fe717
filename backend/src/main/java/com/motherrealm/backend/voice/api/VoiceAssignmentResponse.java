package com.motherrealm.backend.voice.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.voice.service.VoiceAssignment;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

public record VoiceAssignmentResponse(
    String agent,
    String voiceId,
    JsonNode params,
    @Schema(description = "False when the agent has no roster record and only the profile was stored.")
        boolean rosterMirrored,
    Instant lastUpdated) {

  public static VoiceAssignmentResponse from(VoiceAssignment assignment) {
    return new VoiceAssignmentResponse(
        assignment.agent(),
        assignment.voiceId(),
        assignment.parameters().asObjectNode(),
        assignment.rosterMirrored(),
        assignment.lastUpdated());
  }
}
