package com.motherrealm.backend.preference.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(description = "Partial update of a user's preferences; omitted fields keep their stored value.")
public record PreferenceUpdateRequest(
    Boolean voiceEnabled,
    @Size(max = 128) String preferredAgent,
    @Schema(description = "Opaque client session state.") JsonNode session) {}
