package com.gentoro.flowplan.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.exception.SerializationException;
import java.util.ArrayList;
import java.util.List;

public class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectNode createObjectNode() {
    return JSON_MAPPER.createObjectNode();
  }

  public static ArrayNode createArrayNode() {
    return JSON_MAPPER.createArrayNode();
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON document", e);
    }
  }

  public static JsonNode valueToTree(Object value) {
    try {
      return JSON_MAPPER.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Failed to convert value to a JSON tree", e);
    }
  }

  /** Text of {@code field}, or {@code null} when the field is missing, null or not scalar. */
  public static String text(JsonNode node, String field) {
    if (node == null) return null;
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) return null;
    return value.asText();
  }

  public static String text(JsonNode node, String field, String defaultValue) {
    String value = text(node, field);
    return value == null ? defaultValue : value;
  }

  /** Elements of an array field, empty when the field is missing or not an array. */
  public static List<JsonNode> elements(JsonNode node, String field) {
    List<JsonNode> out = new ArrayList<>();
    if (node == null) return out;
    JsonNode value = node.get(field);
    if (value != null && value.isArray()) {
      value.forEach(out::add);
    }
    return out;
  }

  /**
   * Loose truthiness used by the front end: booleans as-is, numbers non-zero, strings {@code
   * true/yes} (case-insensitive), non-empty containers.
   */
  public static boolean isTruthy(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) return false;
    if (value.isBoolean()) return value.booleanValue();
    if (value.isNumber()) return value.doubleValue() != 0d;
    if (value.isTextual()) return StringUtility.parseBoolean(value.textValue());
    return value.size() > 0;
  }
}
