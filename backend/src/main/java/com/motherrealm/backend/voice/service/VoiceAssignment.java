package com.motherrealm.backend.voice.service;

import com.motherrealm.backend.voice.domain.VoiceParameters;
import java.time.Instant;

/**
 * Outcome of a successful voice assignment. {@code rosterMirrored} is false when the agent has no
 * roster record, in which case only the voice profile was written.
 */
public record VoiceAssignment(
    String agent,
    String voiceId,
    VoiceParameters parameters,
    boolean rosterMirrored,
    Instant lastUpdated) {}
