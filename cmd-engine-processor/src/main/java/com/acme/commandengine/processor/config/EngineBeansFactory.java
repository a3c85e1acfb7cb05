package com.acme.commandengine.processor.config;

import com.acme.commandengine.config.EngineConfig;
import com.acme.commandengine.config.MessagingConfig;
import com.acme.commandengine.handler.CommandDataValidator;
import com.acme.commandengine.handler.CommandHandler;
import com.acme.commandengine.handler.WriteModelReader;
import com.acme.commandengine.pipeline.CommandPipeline;
import com.acme.commandengine.publish.EventPublisher;
import com.acme.commandengine.publish.UnpublishedEventRecovery;
import com.acme.commandengine.repository.AggregateRepository;
import com.acme.commandengine.spi.EventBus;
import com.acme.commandengine.spi.EventStore;
import com.acme.commandengine.writemodel.WriteModel;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the engine's core beans.
 *
 * <p>The core module is free of framework dependencies; this factory binds its configuration POJOs
 * to {@code engine.*} and {@code messaging.*} and wires the pipeline. The application provides the
 * {@link WriteModel} bean; the event store and the two buses come from the persistence and Kafka
 * modules.
 */
@Factory
public class EngineBeansFactory {

  /** Creates EngineConfig bean populated from application.yml engine.* properties */
  @Singleton
  @ConfigurationProperties("engine")
  public EngineConfig engineConfig() {
    return new EngineConfig();
  }

  /** Creates MessagingConfig bean populated from application.yml messaging.* properties */
  @Singleton
  @ConfigurationProperties("messaging")
  public MessagingConfig messagingConfig() {
    return new MessagingConfig();
  }

  /** Fixed pool running pipeline tasks, sized by engine.command-concurrency */
  @Singleton
  @Named("commandExecutor")
  @Bean(preDestroy = "shutdown")
  public ExecutorService commandExecutor(EngineConfig config) {
    return Executors.newFixedThreadPool(
        Math.max(1, config.getCommandConcurrency()), namedThreads("command-worker"));
  }

  /** Background snapshot writes; kept off the command workers */
  @Singleton
  @Named("snapshotExecutor")
  @Bean(preDestroy = "shutdown")
  public ExecutorService snapshotExecutor() {
    return Executors.newSingleThreadExecutor(namedThreads("snapshot-writer"));
  }

  @Singleton
  public AggregateRepository aggregateRepository(
      WriteModel writeModel,
      EventStore eventStore,
      EngineConfig config,
      @Named("snapshotExecutor") ExecutorService snapshotExecutor) {
    return new AggregateRepository(writeModel, eventStore, config, snapshotExecutor);
  }

  @Singleton
  public CommandHandler commandHandler(AggregateRepository repository) {
    return new CommandHandler(new WriteModelReader(repository), new CommandDataValidator());
  }

  @Singleton
  public EventPublisher eventPublisher(
      @Named("eventBus") EventBus eventBus,
      @Named("flowBus") EventBus flowBus,
      EventStore eventStore) {
    return new EventPublisher(eventBus, flowBus, eventStore);
  }

  @Singleton
  public CommandPipeline commandPipeline(
      WriteModel writeModel,
      AggregateRepository repository,
      CommandHandler handler,
      EventPublisher publisher) {
    return new CommandPipeline(writeModel, repository, handler, publisher);
  }

  @Singleton
  public UnpublishedEventRecovery unpublishedEventRecovery(
      EventStore eventStore, EventPublisher publisher) {
    return new UnpublishedEventRecovery(eventStore, publisher);
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
