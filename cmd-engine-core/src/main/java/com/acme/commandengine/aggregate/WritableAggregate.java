package com.acme.commandengine.aggregate;

import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.core.MissingDataException;
import com.acme.commandengine.core.UnknownEventException;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.EventAuthorization;
import com.acme.commandengine.writemodel.AggregateDefinition;
import com.acme.commandengine.writemodel.EventReducer;
import com.acme.commandengine.writemodel.WriteModel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An aggregate loaded to handle one command. Published events are applied to the state
 * immediately and collected as the uncommitted batch; {@link #revision()} stays at the last
 * replayed event until the next load.
 */
public class WritableAggregate extends ReadableAggregate {
  private final Command command;
  private final List<Event> uncommittedEvents = new ArrayList<>();
  private final CommandAggregate commandView = new CommandView();

  public WritableAggregate(WriteModel writeModel, Command command) {
    super(writeModel, command.contextName(), command.aggregate());
    this.command = command;
  }

  public CommandAggregate forCommands() {
    return commandView;
  }

  public Command command() {
    return command;
  }

  public List<Event> uncommittedEvents() {
    return Collections.unmodifiableList(uncommittedEvents);
  }

  public boolean hasUncommittedEvents() {
    return !uncommittedEvents.isEmpty();
  }

  /** @return {@code state.isAuthorized.owner}, or null before the first ownership transfer */
  public String owner() {
    return state.owner();
  }

  /** @return whether the command named {@code commandName} is flagged with {@code option} */
  public boolean isCommandFlagged(String commandName, String option) {
    return state.flag("commands", commandName, option);
  }

  Event publish(String name, Object data) {
    Objects.requireNonNull(name, "Event name is missing.");
    EventReducer reducer =
        definition.reducer(name).orElseThrow(() -> new UnknownEventException(name));

    String owner = state.owner();
    EventAuthorization isAuthorized =
        new EventAuthorization(
            owner == null ? command.user().id() : owner,
            state.flag("events", name, "forAuthenticated"),
            state.flag("events", name, "forPublic"));
    long eventRevision = revision + uncommittedEvents.size() + 1;
    Event event = Event.causedBy(command, name, Jsons.toNode(data), eventRevision, isAuthorized);

    reducer.apply(forEvents(), event);
    uncommittedEvents.add(event);
    return event;
  }

  Event transferOwnership(Object data) {
    if (data == null) {
      throw new MissingDataException("Data is missing.");
    }
    JsonNode to = Jsons.toNode(data).get("to");
    if (to == null || to.isNull() || to.asText().isEmpty()) {
      throw new MissingDataException("Owner is missing.");
    }
    String currentOwner = state.owner();
    if (to.asText().equals(currentOwner)) {
      throw new IllegalArgumentException("Could not transfer ownership to current owner.");
    }
    ObjectNode payload = Jsons.object();
    payload.put("from", currentOwner);
    payload.put("to", to.asText());
    return publish(AggregateDefinition.TRANSFERRED_OWNERSHIP, payload);
  }

  Event authorize(Object data) {
    JsonNode node = data == null ? null : Jsons.toNode(data);
    if (node != null && !node.isObject()) {
      throw new MissingDataException("Commands and events are missing.");
    }
    return publish(AggregateDefinition.AUTHORIZED, AuthorizationPayload.validate(node, definition));
  }

  private final class CommandView implements CommandAggregate {
    private final Events events = WritableAggregate.this::publish;

    @Override
    public ObjectNode state() {
      return state.get();
    }

    @Override
    public boolean exists() {
      return WritableAggregate.this.exists();
    }

    @Override
    public Events events() {
      return events;
    }

    @Override
    public Event transferOwnership(Object data) {
      return WritableAggregate.this.transferOwnership(data);
    }

    @Override
    public Event authorize(Object data) {
      return WritableAggregate.this.authorize(data);
    }
  }
}
