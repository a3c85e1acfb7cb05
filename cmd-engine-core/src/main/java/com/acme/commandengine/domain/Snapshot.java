package com.acme.commandengine.domain;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.UUID;

/** Materialized state of an aggregate at {@code revision}. */
public record Snapshot(UUID aggregateId, ObjectNode state, long revision) {
  public Snapshot {
    Objects.requireNonNull(aggregateId, "Aggregate id is missing.");
    Objects.requireNonNull(state, "State is missing.");
  }
}
