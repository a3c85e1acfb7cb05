package com.acme.commandengine.pipeline;

import com.acme.commandengine.aggregate.WritableAggregate;

/**
 * A pre- or post-processing stage around command handling. Anything it throws rejects the
 * command.
 */
@FunctionalInterface
public interface AggregateStage {
  void apply(WritableAggregate aggregate) throws Exception;
}
