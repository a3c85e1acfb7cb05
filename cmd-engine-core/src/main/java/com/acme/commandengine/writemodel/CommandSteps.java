package com.acme.commandengine.writemodel;

/** Reusable guard steps for the front of a middleware chain. */
public final class CommandSteps {
  private CommandSteps() {}

  public static CommandHandlerStep onlyIfExists() {
    return (aggregate, command, services) ->
        aggregate.exists() ? HandlerResult.next() : HandlerResult.reject("Aggregate does not exist.");
  }

  public static CommandHandlerStep onlyIfNotExists() {
    return (aggregate, command, services) ->
        aggregate.exists() ? HandlerResult.reject("Aggregate already exists.") : HandlerResult.next();
  }
}
