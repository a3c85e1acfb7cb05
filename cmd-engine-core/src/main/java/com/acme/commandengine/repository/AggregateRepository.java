package com.acme.commandengine.repository;

import com.acme.commandengine.aggregate.ReadableAggregate;
import com.acme.commandengine.aggregate.WritableAggregate;
import com.acme.commandengine.config.EngineConfig;
import com.acme.commandengine.domain.AggregateIdentity;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.Snapshot;
import com.acme.commandengine.spi.EventStore;
import com.acme.commandengine.writemodel.WriteModel;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads aggregates by replaying the event store and appends their uncommitted batches. */
public class AggregateRepository {
  private static final Logger LOG = LoggerFactory.getLogger(AggregateRepository.class);

  private final WriteModel writeModel;
  private final EventStore store;
  private final int snapshotThreshold;
  private final Executor snapshotExecutor;

  public AggregateRepository(
      WriteModel writeModel, EventStore store, EngineConfig config, Executor snapshotExecutor) {
    this.writeModel = writeModel;
    this.store = store;
    this.snapshotThreshold = config.getSnapshotThreshold();
    this.snapshotExecutor = snapshotExecutor;
  }

  /**
   * Applies the latest snapshot, if any, then every later event. A snapshot is written in the
   * background when the replay covered at least the configured number of events.
   *
   * @throws com.acme.commandengine.core.UnknownEventException if a stored event has no reducer in
   *     this aggregate type
   */
  public <A extends ReadableAggregate> A replayAggregate(A aggregate) {
    UUID aggregateId = aggregate.identity().id();
    long fromRevision = 1;
    Optional<Snapshot> snapshot = store.getSnapshot(aggregateId);
    if (snapshot.isPresent()) {
      aggregate.applySnapshot(snapshot.get());
      fromRevision = snapshot.get().revision() + 1;
      LOG.debug("Applied snapshot of {} at revision {}", aggregateId, snapshot.get().revision());
    }

    try (Stream<Event> events = store.getEventStream(aggregateId, fromRevision)) {
      events.forEach(aggregate::applyEvent);
    }

    if (aggregate.revision() - fromRevision >= snapshotThreshold) {
      saveSnapshotInBackground(
          new Snapshot(aggregateId, aggregate.state().deepCopy(), aggregate.revision()));
    }
    return aggregate;
  }

  public ReadableAggregate loadAggregate(String contextName, String aggregateName, UUID aggregateId) {
    return replayAggregate(
        new ReadableAggregate(
            writeModel, contextName, new AggregateIdentity(aggregateName, aggregateId)));
  }

  public WritableAggregate loadAggregateFor(Command command) {
    return replayAggregate(new WritableAggregate(writeModel, command));
  }

  /** @return the committed batch with positions, or an empty list if nothing was staged */
  public List<Event> saveAggregate(WritableAggregate aggregate) {
    List<Event> uncommitted = aggregate.uncommittedEvents();
    if (uncommitted.isEmpty()) {
      return List.of();
    }
    List<Event> committed = store.saveEvents(uncommitted);
    LOG.debug(
        "Saved {} event(s) for {} up to revision {}",
        committed.size(),
        aggregate.identity().id(),
        committed.get(committed.size() - 1).revision());
    return committed;
  }

  private void saveSnapshotInBackground(Snapshot snapshot) {
    CompletableFuture.runAsync(() -> store.saveSnapshot(snapshot), snapshotExecutor)
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                LOG.error(
                    "Failed to save snapshot of {} at revision {}",
                    snapshot.aggregateId(),
                    snapshot.revision(),
                    error);
              } else {
                LOG.debug(
                    "Saved snapshot of {} at revision {}",
                    snapshot.aggregateId(),
                    snapshot.revision());
              }
            });
  }
}
