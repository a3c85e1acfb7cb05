package com.acme.commandengine.domain;

import java.util.UUID;

/**
 * @param revision 1-based position within the aggregate's own history; {@code 0} for outcome
 *     events that are never stored
 * @param position global order assigned by the event store, {@code null} until persisted
 */
public record EventMetadata(
    UUID correlationId,
    UUID causationId,
    long revision,
    Long position,
    EventAuthorization isAuthorized) {

  public EventMetadata withPosition(long newPosition) {
    return new EventMetadata(correlationId, causationId, revision, newPosition, isAuthorized);
  }
}
