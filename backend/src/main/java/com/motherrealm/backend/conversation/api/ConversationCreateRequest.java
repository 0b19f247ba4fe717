package com.motherrealm.backend.conversation.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ConversationCreateRequest(
    @NotBlank @Size(max = 128) String initiator,
    @NotNull
        @Schema(description = "Agent identities; at least two distinct values are required.")
        List<String> participants,
    @JsonProperty("isPrivate") boolean isPrivate) {}
