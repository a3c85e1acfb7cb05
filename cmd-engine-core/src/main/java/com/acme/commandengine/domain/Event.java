package com.acme.commandengine.domain;

import com.acme.commandengine.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** An immutable fact about one aggregate. Only ever copied, never changed after creation. */
public record Event(
    UUID id,
    String contextName,
    AggregateIdentity aggregate,
    String name,
    JsonNode data,
    String userId,
    EventMetadata metadata,
    Instant timestamp) {

  public Event {
    Objects.requireNonNull(id, "Event id is missing.");
    Objects.requireNonNull(contextName, "Context name is missing.");
    Objects.requireNonNull(aggregate, "Aggregate is missing.");
    Objects.requireNonNull(name, "Event name is missing.");
    Objects.requireNonNull(metadata, "Metadata is missing.");
    data = data == null ? Jsons.object() : data.deepCopy();
    timestamp = timestamp == null ? Instant.now() : timestamp;
  }

  public long revision() {
    return metadata.revision();
  }

  public Event withPosition(long position) {
    return new Event(
        id, contextName, aggregate, name, data, userId, metadata.withPosition(position), timestamp);
  }

  /** Creates a not-yet-persisted event caused by {@code command}. */
  public static Event causedBy(
      Command command, String name, JsonNode data, long revision, EventAuthorization isAuthorized) {
    return new Event(
        UUID.randomUUID(),
        command.contextName(),
        command.aggregate(),
        name,
        data,
        command.user().id(),
        new EventMetadata(
            command.metadata().correlationId(), command.id(), revision, null, isAuthorized),
        Instant.now());
  }

  /**
   * Creates the {@code <command>Rejected} / {@code <command>Failed} event reporting why a command
   * produced no events. It is only ever published, never stored.
   */
  public static Event outcomeOf(Command command, String suffix, String reason) {
    return causedBy(
        command,
        command.name() + suffix,
        Jsons.object().put("reason", reason),
        0,
        new EventAuthorization(command.user().id(), false, false));
  }
}
