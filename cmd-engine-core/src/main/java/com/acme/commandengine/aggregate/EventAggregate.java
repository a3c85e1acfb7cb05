package com.acme.commandengine.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The view event reducers work on. Direct mutation of {@link #state()} is allowed. */
public interface EventAggregate {
  ObjectNode state();

  /** Deep-merges {@code partial} into the state. */
  void setState(JsonNode partial);
}
