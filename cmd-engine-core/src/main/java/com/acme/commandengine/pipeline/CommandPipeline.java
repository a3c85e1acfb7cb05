package com.acme.commandengine.pipeline;

import com.acme.commandengine.aggregate.WritableAggregate;
import com.acme.commandengine.authorization.InitializeOwnership;
import com.acme.commandengine.authorization.IsAccessGrantedToAggregate;
import com.acme.commandengine.authorization.IsAccessGrantedToCommand;
import com.acme.commandengine.core.CommandException;
import com.acme.commandengine.core.CommandFailedException;
import com.acme.commandengine.core.CommandRejectedException;
import com.acme.commandengine.core.PermanentException;
import com.acme.commandengine.core.TransientException;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.handler.CommandHandler;
import com.acme.commandengine.publish.EventPublisher;
import com.acme.commandengine.repository.AggregateRepository;
import com.acme.commandengine.writemodel.AggregateDefinition;
import com.acme.commandengine.writemodel.WriteModel;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command through validate, impersonate, load, pre-process, handle, post-process, save
 * and publish. Any failure before publishing ends the run with a {@code <name>Rejected} or {@code
 * <name>Failed} event on both buses instead; that event is never stored.
 *
 * <p>Infrastructure failures ({@link TransientException}, {@link PermanentException}) are not
 * classified here and propagate to the caller, as do failures while publishing. Only a {@link
 * com.acme.commandengine.core.ConcurrencyConflictException} is worth running the pipeline again
 * for; anything else stops the process.
 */
public class CommandPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(CommandPipeline.class);

  private final WriteModel writeModel;
  private final AggregateRepository repository;
  private final CommandHandler handler;
  private final EventPublisher publisher;
  private final List<AggregateStage> preProcess;
  private final List<AggregateStage> postProcess;

  public CommandPipeline(
      WriteModel writeModel,
      AggregateRepository repository,
      CommandHandler handler,
      EventPublisher publisher) {
    this(
        writeModel,
        repository,
        handler,
        publisher,
        List.of(
            new IsAccessGrantedToCommand(),
            new InitializeOwnership(),
            new IsAccessGrantedToAggregate()),
        List.of());
  }

  public CommandPipeline(
      WriteModel writeModel,
      AggregateRepository repository,
      CommandHandler handler,
      EventPublisher publisher,
      List<AggregateStage> preProcess,
      List<AggregateStage> postProcess) {
    this.writeModel = writeModel;
    this.repository = repository;
    this.handler = handler;
    this.publisher = publisher;
    this.preProcess = List.copyOf(preProcess);
    this.postProcess = List.copyOf(postProcess);
  }

  public CommandOutcome process(Command command) {
    LOG.info(
        "Received command {} ({}) for {}.{} {}",
        command.name(),
        command.id(),
        command.contextName(),
        command.aggregate().name(),
        command.aggregate().id());

    Command acting = command;
    List<Event> committed;
    try {
      validateCommand(command);
      acting = impersonateCommand(command);
      WritableAggregate aggregate = repository.loadAggregateFor(acting);
      runStages(preProcess, aggregate);
      handler.handle(aggregate);
      runStages(postProcess, aggregate);
      committed = repository.saveAggregate(aggregate);
    } catch (TransientException | PermanentException e) {
      throw e;
    } catch (CommandException e) {
      return reportOutcome(acting, e);
    } catch (RuntimeException e) {
      return reportOutcome(acting, new CommandFailedException(e.getMessage(), e));
    }

    publisher.publishEvents(acting.aggregate().id(), committed);
    LOG.info(
        "Handled command {} ({}) with {} event(s)", acting.name(), acting.id(), committed.size());
    return CommandOutcome.handled(acting, committed);
  }

  void validateCommand(Command command) {
    if (!writeModel.hasContext(command.contextName())) {
      throw new CommandFailedException("Invalid context name.");
    }
    AggregateDefinition definition =
        writeModel
            .findAggregate(command.contextName(), command.aggregate().name())
            .orElseThrow(() -> new CommandFailedException("Invalid aggregate name."));
    if (!definition.hasCommand(command.name())) {
      throw new CommandFailedException("Invalid command name.");
    }
  }

  Command impersonateCommand(Command command) {
    if (command.impersonationTarget().isEmpty()) {
      return command;
    }
    if (!command.user().canImpersonate()) {
      throw new CommandRejectedException("Impersonation denied.");
    }
    Command impersonated = command.impersonated();
    LOG.debug(
        "Command {} of {} runs as {}", command.id(), command.user().id(), impersonated.user().id());
    return impersonated;
  }

  private static void runStages(List<AggregateStage> stages, WritableAggregate aggregate) {
    for (AggregateStage stage : stages) {
      try {
        stage.apply(aggregate);
      } catch (CommandRejectedException | TransientException | PermanentException e) {
        throw e;
      } catch (Exception e) {
        throw new CommandRejectedException(e.getMessage());
      }
    }
  }

  private CommandOutcome reportOutcome(Command command, CommandException e) {
    String reason = e.reason();
    Event outcome = Event.outcomeOf(command, e.eventNameSuffix(), reason);
    if (e instanceof CommandRejectedException) {
      LOG.info("Rejected command {} ({}): {}", command.name(), command.id(), reason);
    } else {
      LOG.error("Failed to handle command {}: {}", command, reason, e);
    }
    publisher.publishOutcome(outcome);
    return e instanceof CommandRejectedException
        ? CommandOutcome.rejected(command, outcome, reason)
        : CommandOutcome.failed(command, outcome, reason);
  }
}
