package com.motherrealm.backend.voice.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.motherrealm.backend.shared.json.AbstractJsonPayload;

/** Optional synthesis parameters of a voice profile (temperature, speed, ...). */
public final class VoiceParameters extends AbstractJsonPayload {

  private static final VoiceParameters EMPTY = new VoiceParameters(MissingNode.getInstance());

  @JsonCreator
  public VoiceParameters(JsonNode value) {
    super(value);
  }

  public static VoiceParameters empty() {
    return EMPTY;
  }

  public static VoiceParameters from(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return empty();
    }
    if (!value.isObject()) {
      throw new IllegalArgumentException("Voice parameters must be a JSON object");
    }
    return new VoiceParameters(value);
  }
}
