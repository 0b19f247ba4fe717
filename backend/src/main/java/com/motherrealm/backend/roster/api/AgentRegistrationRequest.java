package com.motherrealm.backend.roster.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Registers an agent in the roster or refreshes its endpoint.")
public record AgentRegistrationRequest(
    @Schema(example = "llama-3-70b", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 128)
        String name,
    @Schema(description = "Network address of the worker node.", example = "10.0.0.12:8000")
        @Size(max = 512)
        String address,
    @Schema(description = "Worker type, e.g. chat, vision or speech.", example = "chat")
        @Size(max = 64)
        String type) {}
