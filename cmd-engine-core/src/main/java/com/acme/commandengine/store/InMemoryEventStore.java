package com.acme.commandengine.store;

import com.acme.commandengine.core.ConcurrencyConflictException;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.Snapshot;
import com.acme.commandengine.spi.EventStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Event store kept in memory. Same contract as the JDBC stores, used for tests and embedded use.
 * All operations synchronize on the store; streams are materialized before they are returned.
 */
public class InMemoryEventStore implements EventStore {
  private final Map<UUID, NavigableMap<Long, Stored>> eventsByAggregate = new HashMap<>();
  private final Map<UUID, Snapshot> snapshots = new HashMap<>();
  private long lastPosition;

  @Override
  public synchronized Optional<Snapshot> getSnapshot(UUID aggregateId) {
    Snapshot snapshot = snapshots.get(aggregateId);
    if (snapshot == null) {
      return Optional.empty();
    }
    return Optional.of(new Snapshot(aggregateId, snapshot.state().deepCopy(), snapshot.revision()));
  }

  @Override
  public synchronized Stream<Event> getEventStream(UUID aggregateId, long fromRevision) {
    NavigableMap<Long, Stored> events = eventsByAggregate.get(aggregateId);
    if (events == null) {
      return Stream.empty();
    }
    return events.tailMap(fromRevision, true).values().stream()
        .map(Stored::event)
        .toList()
        .stream();
  }

  @Override
  public synchronized void saveSnapshot(Snapshot snapshot) {
    snapshots.merge(
        snapshot.aggregateId(),
        new Snapshot(snapshot.aggregateId(), snapshot.state().deepCopy(), snapshot.revision()),
        (existing, candidate) -> candidate.revision() > existing.revision() ? candidate : existing);
  }

  @Override
  public synchronized List<Event> saveEvents(List<Event> events) {
    for (Event event : events) {
      NavigableMap<Long, Stored> existing = eventsByAggregate.get(event.aggregate().id());
      if (existing != null && existing.containsKey(event.revision())) {
        throw new ConcurrencyConflictException(event.aggregate().id(), event.revision());
      }
    }
    List<Event> committed = new ArrayList<>(events.size());
    for (Event event : events) {
      Event positioned = event.withPosition(++lastPosition);
      eventsByAggregate
          .computeIfAbsent(event.aggregate().id(), k -> new TreeMap<>())
          .put(event.revision(), new Stored(positioned, false));
      committed.add(positioned);
    }
    return committed;
  }

  @Override
  public synchronized void markEventsAsPublished(
      UUID aggregateId, long fromRevision, long toRevision) {
    NavigableMap<Long, Stored> events = eventsByAggregate.get(aggregateId);
    if (events == null) {
      return;
    }
    events
        .subMap(fromRevision, true, toRevision, true)
        .replaceAll((revision, stored) -> new Stored(stored.event(), true));
  }

  @Override
  public synchronized Stream<Event> getUnpublishedEventStream() {
    return eventsByAggregate.values().stream()
        .flatMap(events -> events.values().stream())
        .filter(stored -> !stored.published())
        .map(Stored::event)
        .sorted(Comparator.comparing(event -> event.metadata().position()))
        .toList()
        .stream();
  }

  public synchronized boolean isPublished(UUID aggregateId, long revision) {
    NavigableMap<Long, Stored> events = eventsByAggregate.get(aggregateId);
    Stored stored = events == null ? null : events.get(revision);
    return stored != null && stored.published();
  }

  private record Stored(Event event, boolean published) {}
}
