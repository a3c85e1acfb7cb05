package com.acme.commandengine.domain;

import com.acme.commandengine.core.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Transport-level details of a command.
 *
 * @param client whatever the inbound transport knows about the sender (token, user, address);
 *     never null, empty when the transport sent nothing
 */
public record CommandMetadata(UUID correlationId, Instant timestamp, ObjectNode client) {
  public CommandMetadata {
    client = client == null ? Jsons.object() : client.deepCopy();
  }

  public static CommandMetadata correlatedBy(UUID correlationId) {
    return new CommandMetadata(correlationId, Instant.now(), null);
  }
}
