package com.motherrealm.backend.command.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RealmCommandResult(
    String action, @JsonProperty("conversation_id") String conversationId) {}
