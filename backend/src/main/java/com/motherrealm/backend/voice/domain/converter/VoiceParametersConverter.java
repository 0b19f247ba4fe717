package com.motherrealm.backend.voice.domain.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.shared.json.AbstractJsonPayloadAttributeConverter;
import com.motherrealm.backend.voice.domain.VoiceParameters;

public class VoiceParametersConverter extends AbstractJsonPayloadAttributeConverter<VoiceParameters> {

  @Override
  protected VoiceParameters emptyValue() {
    return VoiceParameters.empty();
  }

  @Override
  protected VoiceParameters createInstance(JsonNode value) {
    return VoiceParameters.from(value);
  }
}
