package com.acme.commandengine.writemodel;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * How one command is handled. Bare steps and middleware chains run as an ordered list of steps;
 * the guarded form additionally validates the command data against a schema and runs an
 * authorization check before its single handler.
 */
public sealed interface CommandDefinition
    permits CommandDefinition.Single, CommandDefinition.Chain, CommandDefinition.Guarded {

  static CommandDefinition of(CommandHandlerStep step) {
    return new Single(step);
  }

  static CommandDefinition chain(CommandHandlerStep... steps) {
    return new Chain(List.of(steps));
  }

  static CommandDefinition guarded(AuthorizationCheck isAuthorized, CommandHandlerStep handle) {
    return new Guarded(null, isAuthorized, handle);
  }

  static CommandDefinition guarded(
      JsonNode schema, AuthorizationCheck isAuthorized, CommandHandlerStep handle) {
    return new Guarded(schema, isAuthorized, handle);
  }

  /** @return the steps to run in order */
  List<CommandHandlerStep> steps();

  record Single(CommandHandlerStep step) implements CommandDefinition {
    public Single {
      Objects.requireNonNull(step, "Command handler is missing.");
    }

    @Override
    public List<CommandHandlerStep> steps() {
      return List.of(step);
    }
  }

  record Chain(List<CommandHandlerStep> steps) implements CommandDefinition {
    public Chain {
      if (steps == null || steps.isEmpty()) {
        throw new IllegalArgumentException("Command handler chain is empty.");
      }
      steps = List.copyOf(steps);
    }
  }

  record Guarded(JsonNode schema, AuthorizationCheck isAuthorized, CommandHandlerStep handle)
      implements CommandDefinition {
    public Guarded {
      Objects.requireNonNull(isAuthorized, "Is authorized is missing.");
      Objects.requireNonNull(handle, "Handle is missing.");
    }

    public Optional<JsonNode> schemaIfPresent() {
      return Optional.ofNullable(schema);
    }

    @Override
    public List<CommandHandlerStep> steps() {
      return List.of(handle);
    }
  }
}
