package com.motherrealm.backend.shared.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Persists an ordered list of identifiers as a JSON array, keeping insertion order. */
@Converter
public class IdentifierListJsonConverter implements AttributeConverter<List<String>, JsonNode> {

  @Override
  public JsonNode convertToDatabaseColumn(List<String> attribute) {
    ArrayNode array = JsonNodeFactory.instance.arrayNode();
    if (attribute != null) {
      attribute.forEach(array::add);
    }
    return array;
  }

  @Override
  public List<String> convertToEntityAttribute(JsonNode dbData) {
    if (dbData == null || dbData.isNull() || dbData.isMissingNode()) {
      return List.of();
    }
    if (!dbData.isArray()) {
      throw new IllegalStateException("Expected JSON array of identifiers but found " + dbData.getNodeType());
    }
    List<String> values = new ArrayList<>(dbData.size());
    dbData.forEach(node -> values.add(node.asText()));
    return Collections.unmodifiableList(values);
  }
}
