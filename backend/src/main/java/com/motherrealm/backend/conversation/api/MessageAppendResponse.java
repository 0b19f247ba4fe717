package com.motherrealm.backend.conversation.api;

public record MessageAppendResponse(long messageId) {}
