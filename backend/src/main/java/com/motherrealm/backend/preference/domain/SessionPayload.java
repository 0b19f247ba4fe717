package com.motherrealm.backend.preference.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.motherrealm.backend.shared.json.AbstractJsonPayload;

public final class SessionPayload extends AbstractJsonPayload {

  private static final SessionPayload EMPTY = new SessionPayload(MissingNode.getInstance());

  @JsonCreator
  public SessionPayload(JsonNode value) {
    super(value);
  }

  public static SessionPayload empty() {
    return EMPTY;
  }

  public static SessionPayload from(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return empty();
    }
    return new SessionPayload(value);
  }
}
