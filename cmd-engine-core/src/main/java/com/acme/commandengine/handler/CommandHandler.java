package com.acme.commandengine.handler;

import com.acme.commandengine.aggregate.WritableAggregate;
import com.acme.commandengine.core.CommandException;
import com.acme.commandengine.core.CommandFailedException;
import com.acme.commandengine.core.CommandRejectedException;
import com.acme.commandengine.core.PermanentException;
import com.acme.commandengine.core.TransientException;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.writemodel.ApplicationReader;
import com.acme.commandengine.writemodel.CommandDefinition;
import com.acme.commandengine.writemodel.CommandHandlerStep;
import com.acme.commandengine.writemodel.CommandServices;
import com.acme.commandengine.writemodel.HandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the write model's definition of a command against a loaded aggregate.
 *
 * <p>Steps run strictly in order and the first rejection or exception ends the run. Rejections
 * surface as {@link CommandRejectedException}; any other exception is wrapped in a {@link
 * CommandFailedException}. Infrastructure failures ({@link TransientException}, {@link
 * PermanentException}) pass through unwrapped.
 */
public class CommandHandler {
  private static final Logger LOG = LoggerFactory.getLogger(CommandHandler.class);

  private final ApplicationReader app;
  private final CommandDataValidator validator;

  public CommandHandler(ApplicationReader app, CommandDataValidator validator) {
    this.app = app;
    this.validator = validator;
  }

  public void handle(WritableAggregate aggregate) {
    Command command = aggregate.command();
    CommandDefinition definition =
        aggregate
            .definition()
            .command(command.name())
            .orElseThrow(() -> new CommandFailedException("Invalid command name."));
    CommandServices services = servicesFor(aggregate);

    if (definition instanceof CommandDefinition.Guarded guarded) {
      validateData(guarded, command);
      checkAuthorized(guarded, aggregate, command, services);
    }
    for (CommandHandlerStep step : definition.steps()) {
      HandlerResult result = runStep(step, aggregate, command, services);
      if (result instanceof HandlerResult.Rejected rejected) {
        throw new CommandRejectedException(rejected.reason());
      }
    }
  }

  /** A new bundle per command; nothing is shared between two commands. */
  CommandServices servicesFor(WritableAggregate aggregate) {
    Logger logger =
        LoggerFactory.getLogger(
            "writeModel." + aggregate.contextName() + "." + aggregate.identity().name());
    return new CommandServices(app, aggregate.command().metadata().client().deepCopy(), logger);
  }

  private void validateData(CommandDefinition.Guarded guarded, Command command) {
    if (guarded.schema() == null) {
      return;
    }
    try {
      validator.validate(guarded.schema(), command.data());
    } catch (IllegalArgumentException e) {
      throw new CommandFailedException(e.getMessage());
    }
  }

  private void checkAuthorized(
      CommandDefinition.Guarded guarded,
      WritableAggregate aggregate,
      Command command,
      CommandServices services) {
    boolean authorized;
    try {
      authorized = guarded.isAuthorized().isAuthorized(aggregate.forReadOnly(), command, services);
    } catch (TransientException | PermanentException e) {
      throw e;
    } catch (Exception e) {
      LOG.debug("Authorization check of {} threw", command.name(), e);
      authorized = false;
    }
    if (!authorized) {
      throw new CommandRejectedException("Access denied.");
    }
  }

  private HandlerResult runStep(
      CommandHandlerStep step,
      WritableAggregate aggregate,
      Command command,
      CommandServices services) {
    try {
      HandlerResult result = step.handle(aggregate.forCommands(), command, services);
      return result == null ? HandlerResult.next() : result;
    } catch (CommandException | TransientException | PermanentException e) {
      throw e;
    } catch (Exception e) {
      LOG.debug("Command {} ({}) failed in handler", command.name(), command.id(), e);
      throw new CommandFailedException("Failed to handle command.", e);
    }
  }
}
