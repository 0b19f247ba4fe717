package com.motherrealm.backend.command.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RealmCommandRequest(@NotBlank @Size(max = 128) String sender, @NotBlank String prompt) {}
