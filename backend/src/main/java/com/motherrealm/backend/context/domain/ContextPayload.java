package com.motherrealm.backend.context.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.motherrealm.backend.shared.json.AbstractJsonPayload;

/** Free-form structured data captured alongside a query/response pair. */
public final class ContextPayload extends AbstractJsonPayload {

  private static final ContextPayload EMPTY = new ContextPayload(MissingNode.getInstance());

  @JsonCreator
  public ContextPayload(JsonNode value) {
    super(value);
  }

  public static ContextPayload empty() {
    return EMPTY;
  }

  public static ContextPayload from(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return empty();
    }
    return new ContextPayload(value);
  }
}
