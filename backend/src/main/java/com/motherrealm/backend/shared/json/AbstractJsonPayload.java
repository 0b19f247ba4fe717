package com.motherrealm.backend.shared.json;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Immutable JSON value stored in a JSON column. Subclasses give the value a domain name; the
 * wire representation is the raw JSON document.
 */
public abstract class AbstractJsonPayload {

  private final JsonNode value;

  protected AbstractJsonPayload(JsonNode value) {
    this.value = value != null ? value.deepCopy() : MissingNode.getInstance();
  }

  @JsonValue
  public JsonNode json() {
    return isEmpty() ? JsonNodeFactory.instance.objectNode() : value;
  }

  public JsonNode asJson() {
    return value.deepCopy();
  }

  public ObjectNode asObjectNode() {
    if (value.isObject()) {
      return (ObjectNode) value.deepCopy();
    }
    return JsonNodeFactory.instance.objectNode();
  }

  public boolean isEmpty() {
    if (value.isMissingNode() || value.isNull()) {
      return true;
    }
    if (value.isValueNode()) {
      return !StringUtils.hasText(value.asText());
    }
    return value.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    return Objects.equals(json(), ((AbstractJsonPayload) other).json());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), json());
  }

  @Override
  public String toString() {
    return json().toString();
  }
}
