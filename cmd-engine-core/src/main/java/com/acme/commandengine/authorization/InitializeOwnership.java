package com.acme.commandengine.authorization;

import com.acme.commandengine.aggregate.WritableAggregate;
import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.pipeline.AggregateStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Makes the acting user the owner of an aggregate that has no history yet. */
public class InitializeOwnership implements AggregateStage {
  private static final Logger LOG = LoggerFactory.getLogger(InitializeOwnership.class);

  @Override
  public void apply(WritableAggregate aggregate) {
    if (aggregate.exists() || aggregate.hasUncommittedEvents()) {
      return;
    }
    String owner = aggregate.command().user().id();
    aggregate.forCommands().transferOwnership(Jsons.object().put("to", owner));
    LOG.debug("Initialized ownership of {} for {}", aggregate.identity().id(), owner);
  }
}
