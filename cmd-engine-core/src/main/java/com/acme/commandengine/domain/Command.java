package com.acme.commandengine.domain;

import com.acme.commandengine.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A request to change exactly one aggregate. Instances are immutable; impersonation produces a new
 * command rather than rewriting this one.
 */
public record Command(
    UUID id,
    String contextName,
    AggregateIdentity aggregate,
    String name,
    JsonNode data,
    User user,
    ObjectNode custom,
    CommandMetadata metadata) {

  /** Key in {@link #custom()} requesting that the command runs as another user. */
  public static final String AS_USER = "asUser";

  public Command {
    Objects.requireNonNull(id, "Command id is missing.");
    Objects.requireNonNull(contextName, "Context name is missing.");
    Objects.requireNonNull(aggregate, "Aggregate is missing.");
    Objects.requireNonNull(name, "Command name is missing.");
    Objects.requireNonNull(user, "User is missing.");
    data = data == null ? Jsons.object() : data.deepCopy();
    custom = custom == null ? Jsons.object() : custom.deepCopy();
    metadata = metadata == null ? CommandMetadata.correlatedBy(id) : metadata;
  }

  /** @return the user id this command asks to be executed as, if any */
  public Optional<String> impersonationTarget() {
    JsonNode asUser = custom.get(AS_USER);
    if (asUser == null || asUser.isNull() || asUser.asText().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(asUser.asText());
  }

  /**
   * @return a copy acting as the requested user, with the impersonation request removed
   * @throws IllegalStateException if no impersonation was requested
   */
  public Command impersonated() {
    String target =
        impersonationTarget()
            .orElseThrow(() -> new IllegalStateException("Command does not request impersonation"));
    ObjectNode remaining = custom.deepCopy();
    remaining.remove(AS_USER);
    return new Command(id, contextName, aggregate, name, data, User.of(target), remaining, metadata);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private UUID id = UUID.randomUUID();
    private String contextName;
    private String aggregateName;
    private UUID aggregateId;
    private String name;
    private JsonNode data;
    private User user = User.anonymous();
    private ObjectNode custom;
    private UUID correlationId;
    private ObjectNode client;

    private Builder() {}

    public Builder id(UUID id) {
      this.id = id;
      return this;
    }

    public Builder context(String contextName) {
      this.contextName = contextName;
      return this;
    }

    public Builder aggregate(String aggregateName, UUID aggregateId) {
      this.aggregateName = aggregateName;
      this.aggregateId = aggregateId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder data(Object data) {
      this.data = Jsons.toNode(data);
      return this;
    }

    public Builder user(User user) {
      this.user = user;
      return this;
    }

    public Builder custom(Object custom) {
      this.custom = Jsons.toObject(custom);
      return this;
    }

    public Builder correlationId(UUID correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder client(Object client) {
      this.client = Jsons.toObject(client);
      return this;
    }

    public Command build() {
      UUID correlation = correlationId == null ? id : correlationId;
      return new Command(
          id,
          contextName,
          new AggregateIdentity(aggregateName, aggregateId),
          name,
          data,
          user,
          custom,
          new CommandMetadata(correlation, Instant.now(), client));
    }
  }
}
