package com.acme.commandengine.aggregate;

import com.acme.commandengine.core.AggregateNotFoundException;
import com.acme.commandengine.domain.AggregateIdentity;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.Snapshot;
import com.acme.commandengine.writemodel.AggregateDefinition;
import com.acme.commandengine.writemodel.EventReducer;
import com.acme.commandengine.writemodel.WriteModel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * An aggregate instance rebuilt from its history. Instances live for one command or one read and
 * are never shared.
 */
public class ReadableAggregate {
  protected final String contextName;
  protected final AggregateIdentity identity;
  protected final AggregateDefinition definition;
  protected final AggregateState state;
  protected long revision;

  private final ReadOnlyAggregate readOnlyView = new ReadOnlyView();
  private final EventAggregate eventView = new EventView();

  public ReadableAggregate(WriteModel writeModel, String contextName, AggregateIdentity identity) {
    Objects.requireNonNull(writeModel, "Write model is missing.");
    this.contextName = Objects.requireNonNull(contextName, "Context name is missing.");
    this.identity = Objects.requireNonNull(identity, "Aggregate is missing.");
    this.definition = writeModel.aggregate(contextName, identity.name());
    this.state = new AggregateState(definition.initialState());
  }

  public ReadOnlyAggregate forReadOnly() {
    return readOnlyView;
  }

  public EventAggregate forEvents() {
    return eventView;
  }

  /**
   * Replaces the state reference and revision with the snapshot's.
   *
   * @throws IllegalArgumentException if {@code snapshot} is null
   */
  public void applySnapshot(Snapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot is missing.");
    }
    revision = snapshot.revision();
    state.replace(snapshot.state().deepCopy());
  }

  /**
   * Runs the reducer of an already committed event and moves the revision to it.
   *
   * @throws AggregateNotFoundException if this aggregate type has no reducer for the event, which
   *     means the stream belongs to an aggregate of another type
   */
  public void applyEvent(Event event) {
    EventReducer reducer =
        definition
            .reducer(event.name())
            .orElseThrow(
                () ->
                    new AggregateNotFoundException(contextName, identity.name(), identity.id()));
    reducer.apply(eventView, event);
    revision = event.revision();
  }

  public String contextName() {
    return contextName;
  }

  public AggregateIdentity identity() {
    return identity;
  }

  public AggregateDefinition definition() {
    return definition;
  }

  public long revision() {
    return revision;
  }

  public boolean exists() {
    return revision > 0;
  }

  public ObjectNode state() {
    return state.get();
  }

  private final class ReadOnlyView implements ReadOnlyAggregate {
    @Override
    public ObjectNode state() {
      return state.get();
    }

    @Override
    public boolean exists() {
      return ReadableAggregate.this.exists();
    }
  }

  private final class EventView implements EventAggregate {
    @Override
    public ObjectNode state() {
      return state.get();
    }

    @Override
    public void setState(JsonNode partial) {
      state.merge(partial);
    }
  }
}
