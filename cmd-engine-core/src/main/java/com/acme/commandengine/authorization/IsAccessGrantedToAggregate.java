package com.acme.commandengine.authorization;

import com.acme.commandengine.aggregate.WritableAggregate;
import com.acme.commandengine.core.CommandRejectedException;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.pipeline.AggregateStage;

/**
 * Second gate, once the owner is set. The owner always passes; otherwise authenticated users need
 * {@code forAuthenticated} and everybody else {@code forPublic} on the command.
 */
public class IsAccessGrantedToAggregate implements AggregateStage {

  @Override
  public void apply(WritableAggregate aggregate) {
    Command command = aggregate.command();
    String userId = command.user().id();
    if (userId.equals(aggregate.owner())) {
      return;
    }
    if (command.user().isAuthenticated()
        && aggregate.isCommandFlagged(command.name(), "forAuthenticated")) {
      return;
    }
    if (aggregate.isCommandFlagged(command.name(), "forPublic")) {
      return;
    }
    throw new CommandRejectedException("Access denied.");
  }
}
