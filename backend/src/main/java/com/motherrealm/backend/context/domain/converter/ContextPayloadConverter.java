package com.motherrealm.backend.context.domain.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.context.domain.ContextPayload;
import com.motherrealm.backend.shared.json.AbstractJsonPayloadAttributeConverter;

public class ContextPayloadConverter extends AbstractJsonPayloadAttributeConverter<ContextPayload> {

  @Override
  protected ContextPayload emptyValue() {
    return ContextPayload.empty();
  }

  @Override
  protected ContextPayload createInstance(JsonNode value) {
    return ContextPayload.from(value);
  }
}
