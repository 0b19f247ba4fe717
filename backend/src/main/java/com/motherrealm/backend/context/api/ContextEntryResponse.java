package com.motherrealm.backend.context.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.context.domain.ContextEntry;
import java.time.Instant;

public record ContextEntryResponse(
    long id,
    String userId,
    String agent,
    String query,
    String response,
    JsonNode context,
    Instant timestamp) {

  public static ContextEntryResponse from(ContextEntry entry) {
    return new ContextEntryResponse(
        entry.getId(),
        entry.getUserId(),
        entry.getAgentName(),
        entry.getQuery(),
        entry.getResponse(),
        entry.getPayload().json(),
        entry.getCreatedAt());
  }
}
