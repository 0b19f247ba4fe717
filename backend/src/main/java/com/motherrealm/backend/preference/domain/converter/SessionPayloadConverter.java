package com.motherrealm.backend.preference.domain.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.preference.domain.SessionPayload;
import com.motherrealm.backend.shared.json.AbstractJsonPayloadAttributeConverter;

public class SessionPayloadConverter extends AbstractJsonPayloadAttributeConverter<SessionPayload> {

  @Override
  protected SessionPayload emptyValue() {
    return SessionPayload.empty();
  }

  @Override
  protected SessionPayload createInstance(JsonNode value) {
    return SessionPayload.from(value);
  }
}
