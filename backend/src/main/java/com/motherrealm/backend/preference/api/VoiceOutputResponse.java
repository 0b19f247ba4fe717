package com.motherrealm.backend.preference.api;

public record VoiceOutputResponse(String userId, String agent, boolean useVoice) {}
