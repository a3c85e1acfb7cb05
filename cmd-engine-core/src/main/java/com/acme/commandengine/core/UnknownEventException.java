package com.acme.commandengine.core;

/** An event was published or replayed that the aggregate's write model has no reducer for. */
public class UnknownEventException extends IllegalArgumentException {
  private final String eventName;

  public UnknownEventException(String eventName) {
    super("Unknown event.");
    this.eventName = eventName;
  }

  public String getEventName() {
    return eventName;
  }
}
