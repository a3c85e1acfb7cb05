package com.acme.commandengine.aggregate;

import static org.assertj.core.api.Assertions.*;

import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.core.AggregateNotFoundException;
import com.acme.commandengine.domain.AggregateIdentity;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.EventAuthorization;
import com.acme.commandengine.domain.EventMetadata;
import com.acme.commandengine.domain.Snapshot;
import com.acme.commandengine.fixtures.TestWriteModels;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReadableAggregateTest {
  private UUID aggregateId;
  private ReadableAggregate aggregate;

  @BeforeEach
  void setUp() {
    aggregateId = UUID.randomUUID();
    aggregate =
        new ReadableAggregate(
            TestWriteModels.writeModel(), "planning", new AggregateIdentity("peerGroup", aggregateId));
  }

  private Event stored(String name, ObjectNode data, long revision) {
    return new Event(
        UUID.randomUUID(),
        "planning",
        new AggregateIdentity("peerGroup", aggregateId),
        name,
        data,
        "Jane Doe",
        new EventMetadata(
            UUID.randomUUID(),
            UUID.randomUUID(),
            revision,
            revision,
            new EventAuthorization("Jane Doe", false, false)),
        Instant.now());
  }

  @Nested
  @DisplayName("Construction Tests")
  class ConstructionTests {

    @Test
    @DisplayName("Should start from the initial state without existing")
    void testInitial() {
      assertThat(aggregate.revision()).isZero();
      assertThat(aggregate.exists()).isFalse();
      assertThat(aggregate.forReadOnly().exists()).isFalse();
      assertThat(aggregate.state().path("participants").isArray()).isTrue();
    }

    @Test
    @DisplayName("Should refuse unknown aggregate types")
    void testUnknownType() {
      assertThatThrownBy(
              () ->
                  new ReadableAggregate(
                      TestWriteModels.writeModel(),
                      "planning",
                      new AggregateIdentity("nonExistent", UUID.randomUUID())))
          .hasMessage("Invalid aggregate name.");
    }
  }

  @Nested
  @DisplayName("Shared State Tests")
  class SharedStateTests {

    @Test
    @DisplayName("Should expose one state object through every view")
    void testSameReference() {
      assertThat(aggregate.forReadOnly().state()).isSameAs(aggregate.forEvents().state());
    }

    @Test
    @DisplayName("Should make setState visible to the read-only view")
    void testSetState() {
      aggregate.forEvents().setState(Jsons.object().put("initiator", "Jane Doe"));

      assertThat(aggregate.forReadOnly().state().path("initiator").asText()).isEqualTo("Jane Doe");
      assertThat(aggregate.forReadOnly().state().path("participants").isArray()).isTrue();
    }

    @Test
    @DisplayName("Should make direct mutation visible to the read-only view")
    void testDirectMutation() {
      aggregate.applyEvent(stored("joined", Jsons.object().put("participant", "Jane Doe"), 1));

      assertThat(aggregate.forReadOnly().state().path("participants").get(0).asText())
          .isEqualTo("Jane Doe");
      assertThat(aggregate.revision()).isEqualTo(1);
      assertThat(aggregate.exists()).isTrue();
    }
  }

  @Nested
  @DisplayName("Snapshot Tests")
  class SnapshotTests {

    @Test
    @DisplayName("Should replace state and revision")
    void testApplySnapshot() {
      ObjectNode state = Jsons.object().put("initiator", "Jane Doe");

      aggregate.applySnapshot(new Snapshot(aggregateId, state, 42));

      assertThat(aggregate.revision()).isEqualTo(42);
      assertThat(aggregate.forReadOnly().state()).isEqualTo(state);
      assertThat(aggregate.forEvents().state()).isSameAs(aggregate.forReadOnly().state());
      assertThat(aggregate.state().has("participants")).isFalse();
    }

    @Test
    @DisplayName("Should be idempotent")
    void testIdempotent() {
      Snapshot snapshot = new Snapshot(aggregateId, Jsons.object().put("initiator", "Jane Doe"), 7);

      aggregate.applySnapshot(snapshot);
      ObjectNode first = aggregate.state().deepCopy();
      aggregate.applySnapshot(snapshot);

      assertThat(aggregate.state()).isEqualTo(first);
      assertThat(aggregate.revision()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should fail without a snapshot")
    void testMissing() {
      assertThatThrownBy(() -> aggregate.applySnapshot(null))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Snapshot is missing.");
    }
  }

  @Test
  @DisplayName("Should report a stored event without reducer as a missing aggregate")
  void testUnknownEvent() {
    assertThatThrownBy(() -> aggregate.applyEvent(stored("exploded", Jsons.object(), 1)))
        .isInstanceOf(AggregateNotFoundException.class)
        .hasMessage("Aggregate not found.");
    assertThat(aggregate.revision()).isZero();
  }
}
