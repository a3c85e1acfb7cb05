package com.acme.commandengine.writemodel;

import com.acme.commandengine.aggregate.EventAggregate;
import com.acme.commandengine.domain.Event;

/** Folds one event into the aggregate state, either by mutating the state or via setState. */
@FunctionalInterface
public interface EventReducer {
  void apply(EventAggregate aggregate, Event event);
}
