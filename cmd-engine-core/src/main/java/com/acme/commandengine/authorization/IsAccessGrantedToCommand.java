package com.acme.commandengine.authorization;

import com.acme.commandengine.aggregate.WritableAggregate;
import com.acme.commandengine.core.CommandRejectedException;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.pipeline.AggregateStage;

/**
 * First gate, before ownership is known: authenticated users pass, anonymous users only for
 * commands flagged {@code forPublic}.
 */
public class IsAccessGrantedToCommand implements AggregateStage {

  @Override
  public void apply(WritableAggregate aggregate) {
    Command command = aggregate.command();
    if (command.user().isAuthenticated()) {
      return;
    }
    if (aggregate.isCommandFlagged(command.name(), "forPublic")) {
      return;
    }
    throw new CommandRejectedException("Access denied.");
  }
}
