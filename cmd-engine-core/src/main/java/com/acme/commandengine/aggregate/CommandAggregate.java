package com.acme.commandengine.aggregate;

import com.acme.commandengine.domain.Event;

/** The view command handlers work on: read the state and stage new events. */
public interface CommandAggregate extends ReadOnlyAggregate {

  Events events();

  /**
   * Stages a {@code transferredOwnership} event moving ownership to {@code data.to}.
   *
   * @throws com.acme.commandengine.core.MissingDataException if data or {@code to} is missing
   * @throws IllegalArgumentException if {@code to} already owns the aggregate
   */
  Event transferOwnership(Object data);

  /**
   * Stages an {@code authorized} event updating the visibility flags of commands and events.
   *
   * @throws com.acme.commandengine.core.MissingDataException if both sections are missing
   * @throws com.acme.commandengine.core.InvalidAuthorizationException if the payload is malformed
   */
  Event authorize(Object data);

  interface Events {
    /**
     * Creates the event, applies it to the state right away and adds it to the uncommitted batch.
     *
     * @throws com.acme.commandengine.core.UnknownEventException if the aggregate has no reducer
     *     for {@code name}
     */
    Event publish(String name, Object data);

    default Event publish(String name) {
      return publish(name, null);
    }
  }
}
