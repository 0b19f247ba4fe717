package com.motherrealm.backend.voice.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(
    description = "Assigns a voice to an agent, replacing any previous voice and parameters.",
    example =
        """
        {
          "voiceId": "v2/en_speaker_4",
          "params": {"textTemperature": 0.7, "waveformTemperature": 0.7}
        }
        """)
public record VoiceAssignmentRequest(
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank @Size(max = 128) String voiceId,
    @Schema(description = "Optional synthesis parameters; must be a JSON object.") JsonNode params) {}
