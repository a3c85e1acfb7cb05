package com.acme.commandengine.handler;

import com.acme.commandengine.aggregate.ReadOnlyAggregate;
import com.acme.commandengine.aggregate.ReadableAggregate;
import com.acme.commandengine.core.AggregateNotFoundException;
import com.acme.commandengine.repository.AggregateRepository;
import com.acme.commandengine.writemodel.ApplicationReader;
import java.util.UUID;

/** {@link ApplicationReader} that replays the requested aggregate on every read. */
public class WriteModelReader implements ApplicationReader {
  private final AggregateRepository repository;

  public WriteModelReader(AggregateRepository repository) {
    this.repository = repository;
  }

  @Override
  public ContextReader context(String contextName) {
    return aggregateName -> aggregateId -> read(contextName, aggregateName, aggregateId);
  }

  private ReadOnlyAggregate read(String contextName, String aggregateName, UUID aggregateId) {
    ReadableAggregate aggregate =
        repository.loadAggregate(contextName, aggregateName, aggregateId);
    if (!aggregate.exists()) {
      throw new AggregateNotFoundException(contextName, aggregateName, aggregateId);
    }
    return aggregate.forReadOnly();
  }
}
