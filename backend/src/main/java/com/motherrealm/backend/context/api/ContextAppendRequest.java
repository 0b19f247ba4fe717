package com.motherrealm.backend.context.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Query/response pair to append to a user-agent history. Both texts may be empty.")
public record ContextAppendRequest(
    @Schema(example = "What is the capital of France?") String query,
    @Schema(example = "Paris.") String response,
    @Schema(description = "Optional structured context stored with the pair.") JsonNode context) {}
