package com.acme.commandengine.processor;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Serializes work per aggregate id: a task starts only after every task submitted earlier for the
 * same id has finished, successfully or not. Tasks for different ids are not ordered.
 */
class AggregateLanes {

  private final Map<UUID, CompletableFuture<?>> tails = new HashMap<>();

  <T> CompletableFuture<T> submit(UUID aggregateId, Supplier<CompletableFuture<T>> task) {
    CompletableFuture<T> result;
    synchronized (tails) {
      CompletableFuture<?> tail =
          tails.getOrDefault(aggregateId, CompletableFuture.completedFuture(null));
      result = tail.handle((ignored, error) -> null).thenCompose(ignored -> task.get());
      tails.put(aggregateId, result);
    }
    CompletableFuture<T> submitted = result;
    result.whenComplete(
        (ignored, error) -> {
          synchronized (tails) {
            tails.remove(aggregateId, submitted);
          }
        });
    return result;
  }

  /** Number of aggregates with queued or running work. */
  int activeLanes() {
    synchronized (tails) {
      return tails.size();
    }
  }
}
