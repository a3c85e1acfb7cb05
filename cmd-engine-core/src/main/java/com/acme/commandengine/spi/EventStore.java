package com.acme.commandengine.spi;

import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.Snapshot;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Durable, append-only storage of events and snapshots. Returned streams hold store resources
 * and must be closed by the caller.
 */
public interface EventStore {

  Optional<Snapshot> getSnapshot(UUID aggregateId);

  /** Events of one aggregate with {@code revision >= fromRevision}, ordered by revision. */
  Stream<Event> getEventStream(UUID aggregateId, long fromRevision);

  void saveSnapshot(Snapshot snapshot);

  /**
   * Appends the batch atomically and returns it with positions assigned, in submitted order.
   *
   * @throws com.acme.commandengine.core.ConcurrencyConflictException if one of the revisions is
   *     already taken; nothing of the batch is stored then
   */
  List<Event> saveEvents(List<Event> events);

  void markEventsAsPublished(UUID aggregateId, long fromRevision, long toRevision);

  /** Events saved but never marked published, ordered by position. */
  Stream<Event> getUnpublishedEventStream();
}
