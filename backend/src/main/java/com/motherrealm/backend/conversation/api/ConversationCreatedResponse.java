package com.motherrealm.backend.conversation.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConversationCreatedResponse(@JsonProperty("conversation_id") String conversationId) {}
