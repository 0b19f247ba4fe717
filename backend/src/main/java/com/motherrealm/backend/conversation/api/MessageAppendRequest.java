package com.motherrealm.backend.conversation.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MessageAppendRequest(
    @NotBlank @Size(max = 128) String sender,
    @NotNull String content,
    @Size(max = 64) String messageType) {}
