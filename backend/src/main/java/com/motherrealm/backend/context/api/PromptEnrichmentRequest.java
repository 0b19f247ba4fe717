package com.motherrealm.backend.context.api;

import jakarta.validation.constraints.NotBlank;

public record PromptEnrichmentRequest(@NotBlank String prompt) {}
