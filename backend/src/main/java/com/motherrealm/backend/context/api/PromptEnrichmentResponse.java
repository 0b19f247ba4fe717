package com.motherrealm.backend.context.api;

public record PromptEnrichmentResponse(String prompt, int historySize) {}
