package com.motherrealm.backend.preference.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.preference.domain.UserPreference;
import java.time.Instant;

public record PreferenceResponse(
    String userId,
    Boolean voiceEnabled,
    String preferredAgent,
    JsonNode session,
    Instant lastUpdated) {

  public static PreferenceResponse from(UserPreference preference) {
    return new PreferenceResponse(
        preference.getUserId(),
        preference.getVoiceEnabled(),
        preference.getPreferredAgent(),
        preference.getSessionPayload().json(),
        preference.getLastUpdated());
  }
}
