package com.acme.commandengine.processor;

import com.acme.commandengine.config.EngineConfig;
import com.acme.commandengine.core.CommandFailedException;
import com.acme.commandengine.core.ConcurrencyConflictException;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.pipeline.CommandOutcome;
import com.acme.commandengine.pipeline.CommandPipeline;
import com.acme.commandengine.publish.EventPublisher;
import com.acme.commandengine.spi.FatalErrorHandler;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for incoming commands. Commands for the same aggregate run one after another, in
 * submission order; commands for different aggregates run in parallel on the command executor.
 *
 * <p>A {@link ConcurrencyConflictException} re-runs the whole pipeline from a fresh replay, up to
 * {@code engine.max-attempts} times, after which the command is reported as {@code <name>Failed}.
 * Any other exception escaping the pipeline is an infrastructure failure (a lost store or bus
 * connection, an unpublishable batch). It is handed to the {@link FatalErrorHandler} and no outcome
 * event is published for the command.
 *
 * <p>The returned future completes once the command's events, or its rejection or failure event,
 * have been published. Callers acknowledge the inbound message only then.
 */
@Singleton
public class CommandProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(CommandProcessor.class);

  private final CommandPipeline pipeline;
  private final EventPublisher publisher;
  private final ExecutorService executor;
  private final FatalErrorHandler fatalErrorHandler;
  private final int maxAttempts;
  private final long retryBackoffMillis;
  private final AggregateLanes lanes = new AggregateLanes();

  public CommandProcessor(
      CommandPipeline pipeline,
      EventPublisher publisher,
      EngineConfig config,
      @Named("commandExecutor") ExecutorService executor,
      FatalErrorHandler fatalErrorHandler) {
    this.pipeline = pipeline;
    this.publisher = publisher;
    this.executor = executor;
    this.fatalErrorHandler = fatalErrorHandler;
    this.maxAttempts = Math.max(1, config.getMaxAttempts());
    this.retryBackoffMillis = config.getRetryBackoffMillis();
  }

  public CompletableFuture<CommandOutcome> submit(Command command) {
    return lanes.submit(
        command.aggregate().id(),
        () -> CompletableFuture.supplyAsync(() -> process(command), executor));
  }

  CommandOutcome process(Command command) {
    for (int attempt = 1; ; attempt++) {
      try {
        return pipeline.process(command);
      } catch (ConcurrencyConflictException e) {
        if (attempt >= maxAttempts || !backOff(attempt)) {
          return reportExhausted(command, e, attempt);
        }
        LOG.warn(
            "Attempt {} of command {} ({}) conflicted, retrying: {}",
            attempt,
            command.name(),
            command.id(),
            e.getMessage());
      } catch (RuntimeException e) {
        fatalErrorHandler.onFatalError(
            "Infrastructure failure while processing command " + command.id(), e);
        throw e;
      }
    }
  }

  int activeAggregates() {
    return lanes.activeLanes();
  }

  private CommandOutcome reportExhausted(
      Command command, ConcurrencyConflictException e, int attempts) {
    CommandFailedException failure = new CommandFailedException(e.getMessage(), e);
    LOG.error(
        "Giving up on command {} after {} attempt(s): {}", command, attempts, failure.reason(), e);
    Event outcome = Event.outcomeOf(command, failure.eventNameSuffix(), failure.reason());
    try {
      publisher.publishOutcome(outcome);
    } catch (RuntimeException publishFailure) {
      fatalErrorHandler.onFatalError(
          "Failed to publish failure of command " + command.id(), publishFailure);
      throw publishFailure;
    }
    return CommandOutcome.failed(command, outcome, failure.reason());
  }

  /** @return false if interrupted while waiting */
  private boolean backOff(int attempt) {
    if (retryBackoffMillis <= 0) {
      return true;
    }
    try {
      Thread.sleep(retryBackoffMillis * attempt);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
