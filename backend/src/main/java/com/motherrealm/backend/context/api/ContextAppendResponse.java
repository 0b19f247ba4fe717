package com.motherrealm.backend.context.api;

public record ContextAppendResponse(long id) {}
