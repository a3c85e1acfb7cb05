package com.acme.commandengine.writemodel;

import com.acme.commandengine.aggregate.EventAggregate;
import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.domain.Event;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Initial state, command definitions and event reducers of one aggregate type.
 *
 * <p>Every definition carries the two ownership reducers {@value #TRANSFERRED_OWNERSHIP} and
 * {@value #AUTHORIZED}, and its initial state always has {@code isAuthorized.commands} and
 * {@code isAuthorized.events} objects.
 */
public final class AggregateDefinition {
  public static final String TRANSFERRED_OWNERSHIP = "transferredOwnership";
  public static final String AUTHORIZED = "authorized";

  private final ObjectNode initialState;
  private final Map<String, CommandDefinition> commands;
  private final Map<String, EventReducer> events;

  private AggregateDefinition(
      ObjectNode initialState,
      Map<String, CommandDefinition> commands,
      Map<String, EventReducer> events) {
    this.initialState = initialState;
    this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    this.events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
  }

  /** @return a fresh deep copy, safe to mutate */
  public ObjectNode initialState() {
    return initialState.deepCopy();
  }

  public Optional<CommandDefinition> command(String name) {
    return Optional.ofNullable(commands.get(name));
  }

  public Optional<EventReducer> reducer(String name) {
    return Optional.ofNullable(events.get(name));
  }

  public boolean hasCommand(String name) {
    return commands.containsKey(name);
  }

  public boolean hasEvent(String name) {
    return events.containsKey(name);
  }

  public Map<String, CommandDefinition> commands() {
    return commands;
  }

  public Map<String, EventReducer> events() {
    return events;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ObjectNode initialState = Jsons.object();
    private final Map<String, CommandDefinition> commands = new LinkedHashMap<>();
    private final Map<String, EventReducer> events = new LinkedHashMap<>();

    private Builder() {}

    public Builder initialState(Object initialState) {
      this.initialState = Jsons.toObject(initialState).deepCopy();
      return this;
    }

    public Builder command(String name, CommandDefinition definition) {
      Objects.requireNonNull(name, "Command name is missing.");
      commands.put(name, Objects.requireNonNull(definition, "Command definition is missing."));
      return this;
    }

    public Builder command(String name, CommandHandlerStep step) {
      return command(name, CommandDefinition.of(step));
    }

    public Builder command(String name, CommandHandlerStep... chain) {
      return command(name, CommandDefinition.chain(chain));
    }

    public Builder event(String name, EventReducer reducer) {
      Objects.requireNonNull(name, "Event name is missing.");
      events.put(name, Objects.requireNonNull(reducer, "Event reducer is missing."));
      return this;
    }

    public AggregateDefinition build() {
      ObjectNode state = initialState.deepCopy();
      ObjectNode isAuthorized = objectField(state, "isAuthorized");
      objectField(isAuthorized, "commands");
      objectField(isAuthorized, "events");

      Map<String, EventReducer> reducers = new LinkedHashMap<>(events);
      reducers.putIfAbsent(TRANSFERRED_OWNERSHIP, AggregateDefinition::transferredOwnership);
      reducers.putIfAbsent(AUTHORIZED, AggregateDefinition::authorized);
      return new AggregateDefinition(state, commands, reducers);
    }
  }

  private static void transferredOwnership(EventAggregate aggregate, Event event) {
    objectField(aggregate.state(), "isAuthorized").set("owner", event.data().get("to"));
  }

  private static void authorized(EventAggregate aggregate, Event event) {
    ObjectNode isAuthorized = objectField(aggregate.state(), "isAuthorized");
    JsonNode commands = event.data().get("commands");
    if (commands != null && commands.isObject()) {
      Jsons.deepMerge(objectField(isAuthorized, "commands"), commands);
    }
    JsonNode events = event.data().get("events");
    if (events != null && events.isObject()) {
      Jsons.deepMerge(objectField(isAuthorized, "events"), events);
    }
  }

  private static ObjectNode objectField(ObjectNode parent, String name) {
    JsonNode existing = parent.get(name);
    if (existing instanceof ObjectNode object) {
      return object;
    }
    return parent.putObject(name);
  }
}
