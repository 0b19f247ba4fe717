package com.motherrealm.backend.voice.service;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Voice of an agent as returned by a lookup; {@code params} is an empty object when unset. */
public record VoiceSelection(String voiceId, ObjectNode params) {}
