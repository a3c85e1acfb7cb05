package com.acme.commandengine.aggregate;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Read access to an aggregate, handed to authorization checks and other aggregates' readers. */
public interface ReadOnlyAggregate {
  ObjectNode state();

  boolean exists();
}
