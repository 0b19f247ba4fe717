package com.motherrealm.backend.voice.api;

import com.fasterxml.jackson.databind.JsonNode;

public record VoiceResponse(String agent, String voiceId, JsonNode params) {}
