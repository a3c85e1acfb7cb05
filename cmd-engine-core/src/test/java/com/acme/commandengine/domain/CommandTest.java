package com.acme.commandengine.domain;

import static org.assertj.core.api.Assertions.*;

import com.acme.commandengine.core.Jsons;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CommandTest {

  private static Command.Builder peerGroupCommand() {
    return Command.builder()
        .context("planning")
        .aggregate("peerGroup", UUID.randomUUID())
        .name("join")
        .data(Map.of("participant", "Jane Doe"));
  }

  @Nested
  @DisplayName("Builder Tests")
  class BuilderTests {

    @Test
    @DisplayName("Should default to the anonymous user and correlate by its own id")
    void testDefaults() {
      Command command = peerGroupCommand().build();

      assertThat(command.user().isAuthenticated()).isFalse();
      assertThat(command.user().id()).isEqualTo(User.ANONYMOUS_ID);
      assertThat(command.metadata().correlationId()).isEqualTo(command.id());
      assertThat(command.custom().size()).isZero();
    }

    @Test
    @DisplayName("Should require context, aggregate and name")
    void testRequiredFields() {
      assertThatThrownBy(
              () -> Command.builder().aggregate("peerGroup", UUID.randomUUID()).name("x").build())
          .isInstanceOf(NullPointerException.class)
          .hasMessage("Context name is missing.");
    }

    @Test
    @DisplayName("Should copy data so later changes do not leak in")
    void testDataCopied() {
      var data = Jsons.object().put("participant", "Jane Doe");
      Command command = peerGroupCommand().data(data).build();

      data.put("participant", "Someone else");

      assertThat(command.data().path("participant").asText()).isEqualTo("Jane Doe");
    }
  }

  @Nested
  @DisplayName("Impersonation Tests")
  class ImpersonationTests {

    @Test
    @DisplayName("Should report no target without asUser")
    void testNoTarget() {
      assertThat(peerGroupCommand().build().impersonationTarget()).isEmpty();
    }

    @Test
    @DisplayName("Should switch the user and drop the request")
    void testImpersonated() {
      Command command =
          peerGroupCommand()
              .user(new User("admin", Map.of(User.CAN_IMPERSONATE_CLAIM, true)))
              .custom(Map.of(Command.AS_USER, "Jane Doe", "other", "kept"))
              .build();

      Command impersonated = command.impersonated();

      assertThat(impersonated.user().id()).isEqualTo("Jane Doe");
      assertThat(impersonated.custom().has(Command.AS_USER)).isFalse();
      assertThat(impersonated.custom().path("other").asText()).isEqualTo("kept");
      assertThat(impersonated.id()).isEqualTo(command.id());
      assertThat(command.user().id()).isEqualTo("admin");
    }

    @Test
    @DisplayName("Should only let users with the claim impersonate")
    void testCanImpersonate() {
      assertThat(new User("admin", Map.of(User.CAN_IMPERSONATE_CLAIM, true)).canImpersonate())
          .isTrue();
      assertThat(User.of("Jane Doe").canImpersonate()).isFalse();
    }

    @Test
    @DisplayName("Should accept token claims without value")
    void testNullClaim() {
      Map<String, Object> token = new HashMap<>();
      token.put("sub", "Jane Doe");
      token.put("email", null);

      User user = new User("Jane Doe", token);
      token.put("sub", "changed");

      assertThat(user.token()).containsEntry("email", null).containsEntry("sub", "Jane Doe");
      assertThat(user.canImpersonate()).isFalse();
      assertThatThrownBy(() -> user.token().put("sub", "x"))
          .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should keep the client metadata when impersonating")
    void testImpersonationKeepsClient() {
      Command command =
          Command.builder()
              .context("planning")
              .aggregate("peerGroup", UUID.randomUUID())
              .name("join")
              .user(new User("admin", Map.of(User.CAN_IMPERSONATE_CLAIM, true)))
              .custom(Map.of(Command.AS_USER, "Jane Doe"))
              .client(Map.of("ip", "10.0.0.7"))
              .build();

      assertThat(command.impersonated().metadata().client().path("ip").asText())
          .isEqualTo("10.0.0.7");
    }
  }

  @Nested
  @DisplayName("Event Factory Tests")
  class EventFactoryTests {

    @Test
    @DisplayName("Should link caused events to the command")
    void testCausedBy() {
      Command command = peerGroupCommand().user(User.of("Jane Doe")).build();

      Event event =
          Event.causedBy(
              command, "joined", null, 4, new EventAuthorization("Jane Doe", true, false));

      assertThat(event.metadata().causationId()).isEqualTo(command.id());
      assertThat(event.metadata().correlationId()).isEqualTo(command.metadata().correlationId());
      assertThat(event.revision()).isEqualTo(4);
      assertThat(event.metadata().position()).isNull();
      assertThat(event.userId()).isEqualTo("Jane Doe");
    }

    @Test
    @DisplayName("Should build outcome events carrying the reason")
    void testOutcomeOf() {
      Command command = peerGroupCommand().build();

      Event event = Event.outcomeOf(command, "Rejected", "Access denied.");

      assertThat(event.name()).isEqualTo("joinRejected");
      assertThat(event.data().path("reason").asText()).isEqualTo("Access denied.");
      assertThat(event.metadata().isAuthorized().forPublic()).isFalse();
    }
  }
}
