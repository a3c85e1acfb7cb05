package com.acme.commandengine.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Iterator;
import java.util.Map;

/**
 * Shared Jackson helpers. Aggregate state, command data and event data are all handled as
 * {@link JsonNode} trees, so everything that needs to copy, merge or serialize them goes through
 * here.
 */
public final class Jsons {
  private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());

  private Jsons() {}

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return M.readTree(json);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static ObjectNode object() {
    return M.createObjectNode();
  }

  /** Converts a POJO, map or JSON node into a tree. {@code null} becomes an empty object. */
  public static JsonNode toNode(Object o) {
    if (o == null) {
      return M.createObjectNode();
    }
    if (o instanceof JsonNode node) {
      return node;
    }
    return M.valueToTree(o);
  }

  /** Same as {@link #toNode(Object)} but insists on an object at the root. */
  public static ObjectNode toObject(Object o) {
    JsonNode node = toNode(o);
    if (!node.isObject()) {
      throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
    }
    return (ObjectNode) node;
  }

  public static Map<String, Object> toMap(JsonNode node) {
    @SuppressWarnings("unchecked")
    Map<String, Object> map = M.convertValue(node, Map.class);
    return map;
  }

  /**
   * Deep-merges {@code source} into {@code target} in place. Objects are merged key by key,
   * arrays are merged index by index, everything else in {@code source} replaces the value in
   * {@code target}.
   *
   * @return {@code target}
   */
  public static ObjectNode deepMerge(ObjectNode target, JsonNode source) {
    if (source == null || source.isNull() || source.isMissingNode()) {
      return target;
    }
    if (!source.isObject()) {
      throw new IllegalArgumentException("Only objects can be merged into state");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      target.set(field.getKey(), mergeValue(target.get(field.getKey()), field.getValue()));
    }
    return target;
  }

  private static JsonNode mergeValue(JsonNode existing, JsonNode incoming) {
    if (existing != null && existing.isObject() && incoming.isObject()) {
      return deepMerge((ObjectNode) existing, incoming);
    }
    if (existing != null && existing.isArray() && incoming.isArray()) {
      ArrayNode target = (ArrayNode) existing;
      for (int i = 0; i < incoming.size(); i++) {
        JsonNode merged = i < target.size() ? mergeValue(target.get(i), incoming.get(i)) : copy(incoming.get(i));
        if (i < target.size()) {
          target.set(i, merged);
        } else {
          target.add(merged);
        }
      }
      return target;
    }
    return copy(incoming);
  }

  private static JsonNode copy(JsonNode node) {
    return node.isContainerNode() ? node.deepCopy() : node;
  }
}
