package com.acme.commandengine.writemodel;

import static org.assertj.core.api.Assertions.*;

import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.fixtures.TestWriteModels;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WriteModelTest {

  @Nested
  @DisplayName("Lookup Tests")
  class LookupTests {
    private final WriteModel writeModel = TestWriteModels.writeModel();

    @Test
    @DisplayName("Should find defined aggregates")
    void testFind() {
      assertThat(writeModel.findAggregate("planning", "peerGroup")).isPresent();
      assertThat(writeModel.hasContext("sampleContext")).isTrue();
    }

    @Test
    @DisplayName("Should report unknown contexts and aggregates")
    void testUnknown() {
      assertThat(writeModel.findAggregate("planning", "nonExistent")).isEmpty();
      assertThat(writeModel.findAggregate(null, "peerGroup")).isEmpty();
      assertThatThrownBy(() -> writeModel.aggregate("nonExistent", "peerGroup"))
          .hasMessage("Invalid context name.");
      assertThatThrownBy(() -> writeModel.aggregate("planning", "nonExistent"))
          .hasMessage("Invalid aggregate name.");
    }
  }

  @Nested
  @DisplayName("AggregateDefinition Tests")
  class AggregateDefinitionTests {

    @Test
    @DisplayName("Should always contribute the ownership reducers")
    void testBuiltInReducers() {
      AggregateDefinition definition = AggregateDefinition.builder().build();

      assertThat(definition.hasEvent(AggregateDefinition.TRANSFERRED_OWNERSHIP)).isTrue();
      assertThat(definition.hasEvent(AggregateDefinition.AUTHORIZED)).isTrue();
    }

    @Test
    @DisplayName("Should guarantee isAuthorized sections in the initial state")
    void testIsAuthorizedSections() {
      AggregateDefinition definition =
          AggregateDefinition.builder().initialState(Map.of("counter", 0)).build();

      ObjectNode state = definition.initialState();

      assertThat(state.path("counter").asInt()).isZero();
      assertThat(state.path("isAuthorized").path("commands").isObject()).isTrue();
      assertThat(state.path("isAuthorized").path("events").isObject()).isTrue();
    }

    @Test
    @DisplayName("Should hand out independent copies of the initial state")
    void testInitialStateCopies() {
      AggregateDefinition definition = TestWriteModels.peerGroup();

      definition.initialState().put("initiator", "changed");

      assertThat(definition.initialState().get("initiator").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should normalize single steps and chains into ordered steps")
    void testNormalization() {
      CommandHandlerStep first = (aggregate, command, services) -> HandlerResult.next();
      CommandHandlerStep second = (aggregate, command, services) -> HandlerResult.reject("no");

      assertThat(CommandDefinition.of(first).steps()).containsExactly(first);
      assertThat(CommandDefinition.chain(first, second).steps()).containsExactly(first, second);
      assertThat(CommandDefinition.guarded(AuthorizationCheck.forPublic(), second).steps())
          .containsExactly(second);
    }

    @Test
    @DisplayName("Should refuse empty chains")
    void testEmptyChain() {
      assertThatThrownBy(() -> CommandDefinition.chain()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep a guarded command's schema")
    void testGuardedSchema() {
      ObjectNode schema = Jsons.object().put("type", "object");

      CommandDefinition.Guarded guarded =
          (CommandDefinition.Guarded)
              CommandDefinition.guarded(
                  schema, AuthorizationCheck.forPublic(), (a, c, s) -> HandlerResult.next());

      assertThat(guarded.schemaIfPresent()).contains(schema);
    }
  }
}
