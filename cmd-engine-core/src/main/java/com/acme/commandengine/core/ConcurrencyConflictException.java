package com.acme.commandengine.core;

import java.util.UUID;

/**
 * Raised by an event store when a batch could not be appended because another batch for the same
 * aggregate claimed one of its revisions first.
 */
public class ConcurrencyConflictException extends TransientException {
  private final UUID aggregateId;
  private final long revision;

  public ConcurrencyConflictException(UUID aggregateId, long revision) {
    this(aggregateId, revision, null);
  }

  public ConcurrencyConflictException(UUID aggregateId, long revision, Throwable cause) {
    super(
        String.format("Aggregate %s was modified concurrently at revision %d", aggregateId, revision),
        cause);
    this.aggregateId = aggregateId;
    this.revision = revision;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  public long getRevision() {
    return revision;
  }
}
