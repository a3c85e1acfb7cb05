package com.acme.commandengine.domain;

import java.util.Objects;
import java.util.UUID;

/** Names one aggregate instance within a context: the aggregate type plus the instance id. */
public record AggregateIdentity(String name, UUID id) {
  public AggregateIdentity {
    Objects.requireNonNull(name, "Aggregate name is missing.");
    Objects.requireNonNull(id, "Aggregate id is missing.");
  }
}
