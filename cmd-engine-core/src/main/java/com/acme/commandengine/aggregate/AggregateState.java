package com.acme.commandengine.aggregate;

import com.acme.commandengine.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * The single mutable state cell behind all views of one aggregate instance. Views never cache
 * {@link #get()}, so replacing the value (snapshot) is seen by every view at once.
 */
final class AggregateState {
  private ObjectNode value;

  AggregateState(ObjectNode initial) {
    this.value = Objects.requireNonNull(initial);
  }

  ObjectNode get() {
    return value;
  }

  void replace(ObjectNode newValue) {
    this.value = Objects.requireNonNull(newValue);
  }

  void merge(JsonNode partial) {
    Jsons.deepMerge(value, partial);
  }

  /** Reads {@code state.isAuthorized.<section>.<name>.<option>}, false when absent. */
  boolean flag(String section, String name, String option) {
    return value.path("isAuthorized").path(section).path(name).path(option).asBoolean(false);
  }

  /** @return {@code state.isAuthorized.owner}, or null while ownership is not established */
  String owner() {
    JsonNode owner = value.path("isAuthorized").get("owner");
    return owner == null || owner.isNull() ? null : owner.asText();
  }
}
