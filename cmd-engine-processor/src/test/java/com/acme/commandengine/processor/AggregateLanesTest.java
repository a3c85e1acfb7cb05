package com.acme.commandengine.processor;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AggregateLanes Tests")
class AggregateLanesTest {

  private final AggregateLanes lanes = new AggregateLanes();

  @Test
  @DisplayName("should not start a task before the earlier task of the same aggregate finished")
  void testSameAggregateSerialized() throws Exception {
    UUID id = UUID.randomUUID();
    List<String> order = new CopyOnWriteArrayList<>();
    CompletableFuture<String> gate = new CompletableFuture<>();

    CompletableFuture<String> first =
        lanes.submit(id, () -> gate.thenApply(v -> record(order, "first")));
    CompletableFuture<String> second =
        lanes.submit(id, () -> CompletableFuture.completedFuture(record(order, "second")));

    assertThat(second).isNotDone();
    gate.complete("go");

    assertThat(second.get(1, TimeUnit.SECONDS)).isEqualTo("second");
    assertThat(first).isCompletedWithValue("first");
    assertThat(order).containsExactly("first", "second");
  }

  @Test
  @DisplayName("should run tasks of different aggregates independently")
  void testDifferentAggregatesIndependent() {
    CompletableFuture<String> blocked = new CompletableFuture<>();

    lanes.submit(UUID.randomUUID(), () -> blocked);
    CompletableFuture<String> other =
        lanes.submit(UUID.randomUUID(), () -> CompletableFuture.completedFuture("done"));

    assertThat(other).isCompletedWithValue("done");
    blocked.complete("released");
  }

  @Test
  @DisplayName("should continue a lane after a failed task")
  void testContinuesAfterFailure() {
    UUID id = UUID.randomUUID();

    CompletableFuture<String> failed =
        lanes.submit(id, () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
    CompletableFuture<String> next =
        lanes.submit(id, () -> CompletableFuture.completedFuture("next"));

    assertThat(failed).isCompletedExceptionally();
    assertThat(next).isCompletedWithValue("next");
  }

  @Test
  @DisplayName("should forget a lane once its last task completed")
  void testLaneRemoved() {
    CompletableFuture<String> pending = new CompletableFuture<>();
    lanes.submit(UUID.randomUUID(), () -> pending);
    assertThat(lanes.activeLanes()).isEqualTo(1);

    pending.complete("done");

    assertThat(lanes.activeLanes()).isZero();
  }

  private static String record(List<String> order, String name) {
    order.add(name);
    return name;
  }
}
