package com.acme.commandengine.core;

import java.util.UUID;

public class AggregateNotFoundException extends RuntimeException {
  private final String contextName;
  private final String aggregateName;
  private final UUID aggregateId;

  public AggregateNotFoundException(String contextName, String aggregateName, UUID aggregateId) {
    super("Aggregate not found.");
    this.contextName = contextName;
    this.aggregateName = aggregateName;
    this.aggregateId = aggregateId;
  }

  public String getContextName() {
    return contextName;
  }

  public String getAggregateName() {
    return aggregateName;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }
}
