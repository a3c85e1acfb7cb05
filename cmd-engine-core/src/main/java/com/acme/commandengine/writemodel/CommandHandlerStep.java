package com.acme.commandengine.writemodel;

import com.acme.commandengine.aggregate.CommandAggregate;
import com.acme.commandengine.domain.Command;

/**
 * One link of a command-handling chain. It may publish events through {@code aggregate}, return
 * {@link HandlerResult#reject(String)} to refuse the command, or throw to fail it.
 */
@FunctionalInterface
public interface CommandHandlerStep {
  HandlerResult handle(CommandAggregate aggregate, Command command, CommandServices services)
      throws Exception;
}
