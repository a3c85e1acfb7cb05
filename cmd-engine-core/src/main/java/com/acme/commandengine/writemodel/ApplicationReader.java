package com.acme.commandengine.writemodel;

import com.acme.commandengine.aggregate.ReadOnlyAggregate;
import java.util.UUID;

/**
 * Read-only query surface over the write model, used as
 * {@code app.context("planning").aggregate("peerGroup").read(id)}.
 */
public interface ApplicationReader {

  ContextReader context(String contextName);

  interface ContextReader {
    AggregateReader aggregate(String aggregateName);
  }

  interface AggregateReader {
    /**
     * Replays the aggregate and returns its read-only view.
     *
     * @throws com.acme.commandengine.core.AggregateNotFoundException if it has no events yet
     */
    ReadOnlyAggregate read(UUID aggregateId);
  }
}
