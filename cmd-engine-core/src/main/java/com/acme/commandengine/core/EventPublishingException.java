package com.acme.commandengine.core;

import java.util.UUID;

/**
 * Publishing an event did not complete: a bus refused it, or it could not be marked published.
 * Events after it in the same batch were not attempted.
 */
public class EventPublishingException extends RuntimeException {
  private final UUID eventId;

  public EventPublishingException(UUID eventId, String bus, Throwable cause) {
    super(String.format("Failed to write event %s to %s", eventId, bus), cause);
    this.eventId = eventId;
  }

  public EventPublishingException(String message, UUID eventId, Throwable cause) {
    super(message, cause);
    this.eventId = eventId;
  }

  public UUID getEventId() {
    return eventId;
  }
}
