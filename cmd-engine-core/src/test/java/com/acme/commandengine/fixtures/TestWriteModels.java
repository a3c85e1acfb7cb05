package com.acme.commandengine.fixtures;

import com.acme.commandengine.aggregate.CommandAggregate;
import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.domain.Command;
import com.acme.commandengine.writemodel.AggregateDefinition;
import com.acme.commandengine.writemodel.AuthorizationCheck;
import com.acme.commandengine.writemodel.CommandDefinition;
import com.acme.commandengine.writemodel.CommandServices;
import com.acme.commandengine.writemodel.CommandSteps;
import com.acme.commandengine.writemodel.HandlerResult;
import com.acme.commandengine.writemodel.WriteModel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.UUID;

/**
 * Write model used across the engine tests: a {@code planning.peerGroup} aggregate for the
 * regular command flow and a {@code sampleContext.sampleAggregate} with guarded commands.
 */
public final class TestWriteModels {
  public static final String PLANNING = "planning";
  public static final String PEER_GROUP = "peerGroup";
  public static final String SAMPLE_CONTEXT = "sampleContext";
  public static final String SAMPLE_AGGREGATE = "sampleAggregate";

  private TestWriteModels() {}

  public static WriteModel writeModel() {
    return WriteModel.builder()
        .aggregate(PLANNING, PEER_GROUP, peerGroup())
        .aggregate(SAMPLE_CONTEXT, SAMPLE_AGGREGATE, sampleAggregate())
        .build();
  }

  public static AggregateDefinition peerGroup() {
    ObjectNode initialState = Jsons.object();
    initialState.putNull("initiator");
    initialState.putNull("destination");
    initialState.putArray("participants");
    ObjectNode commands = initialState.putObject("isAuthorized").putObject("commands");
    for (String name :
        new String[] {
          "start",
          "join",
          "joinAndFail",
          "joinWithFailingMiddleware",
          "joinWithRejectingMiddleware",
          "transferOwnership",
          "authorize"
        }) {
      commands.putObject(name).put("forAuthenticated", true).put("forPublic", true);
    }
    commands.putObject("joinOnlyForOwner").put("forAuthenticated", false).put("forPublic", false);
    commands
        .putObject("joinForAuthenticated")
        .put("forAuthenticated", true)
        .put("forPublic", false);
    ObjectNode events = ((ObjectNode) initialState.get("isAuthorized")).putObject("events");
    events.putObject("started").put("forAuthenticated", true).put("forPublic", true);
    events.putObject("joined").put("forAuthenticated", true).put("forPublic", false);

    return AggregateDefinition.builder()
        .initialState(initialState)
        .command(
            "start",
            CommandSteps.onlyIfNotExists(),
            (aggregate, command, services) -> {
              String initiator = command.data().path("initiator").asText();
              aggregate
                  .events()
                  .publish(
                      "started",
                      Jsons.object()
                          .put("initiator", initiator)
                          .put("destination", command.data().path("destination").asText()));
              aggregate.events().publish("joined", Jsons.object().put("participant", initiator));
              return HandlerResult.next();
            })
        .command(
            "join",
            CommandSteps.onlyIfExists(),
            (aggregate, command, services) -> {
              String participant = command.data().path("participant").asText();
              for (JsonNode existing : aggregate.state().path("participants")) {
                if (existing.asText().equals(participant)) {
                  return HandlerResult.reject("Participant had already joined.");
                }
              }
              aggregate.events().publish("joined", Jsons.object().put("participant", participant));
              return HandlerResult.next();
            })
        .command(
            "joinAndFail",
            CommandDefinition.of(
                (aggregate, command, services) -> {
                  throw new IllegalStateException("Something, somewhere went horribly wrong...");
                }))
        .command(
            "joinWithFailingMiddleware",
            (aggregate, command, services) -> {
              throw new IllegalStateException("Failed in middleware.");
            },
            (aggregate, command, services) -> {
              throw new IllegalStateException("Invalid operation.");
            })
        .command(
            "joinWithRejectingMiddleware",
            (aggregate, command, services) -> HandlerResult.reject("Rejected by middleware."),
            (aggregate, command, services) -> {
              aggregate.events().publish("joined", Jsons.object().put("participant", "nobody"));
              return HandlerResult.next();
            })
        .command("joinOnlyForOwner", TestWriteModels::joinAsUser)
        .command("joinForAuthenticated", TestWriteModels::joinAsUser)
        .command(
            "transferOwnership",
            CommandDefinition.of(
                (aggregate, command, services) -> {
                  aggregate.transferOwnership(command.data());
                  return HandlerResult.next();
                }))
        .command(
            "authorize",
            CommandDefinition.of(
                (aggregate, command, services) -> {
                  aggregate.authorize(command.data());
                  return HandlerResult.next();
                }))
        .event(
            "started",
            (aggregate, event) ->
                aggregate.setState(
                    Jsons.object()
                        .put("initiator", event.data().path("initiator").asText())
                        .put("destination", event.data().path("destination").asText())))
        .event(
            "joined",
            (aggregate, event) ->
                ((ArrayNode) aggregate.state().get("participants"))
                    .add(event.data().path("participant").asText()))
        .build();
  }

  public static AggregateDefinition sampleAggregate() {
    ObjectNode initialState = Jsons.object();
    initialState.put("executed", 0);
    ObjectNode commands = initialState.putObject("isAuthorized").putObject("commands");
    for (String name :
        new String[] {
          "authorizedCommand",
          "unauthorizedCommand",
          "failingAuthorizationCommand",
          "validatedCommand",
          "readPeerGroup"
        }) {
      commands.putObject(name).put("forAuthenticated", true).put("forPublic", true);
    }

    ObjectNode schema = Jsons.object();
    schema.put("type", "object");
    schema.putObject("properties").putObject("requiredParameter").put("type", "string");
    schema.putArray("required").add("requiredParameter");

    return AggregateDefinition.builder()
        .initialState(initialState)
        .command(
            "authorizedCommand",
            CommandDefinition.guarded(AuthorizationCheck.forPublic(), TestWriteModels::execute))
        .command(
            "unauthorizedCommand",
            CommandDefinition.guarded(
                (aggregate, command, services) -> false, TestWriteModels::execute))
        .command(
            "failingAuthorizationCommand",
            CommandDefinition.guarded(
                (aggregate, command, services) -> {
                  throw new IllegalStateException("Authorization exploded.");
                },
                TestWriteModels::execute))
        .command(
            "validatedCommand",
            CommandDefinition.guarded(
                schema, AuthorizationCheck.forPublic(), TestWriteModels::execute))
        .command(
            "readPeerGroup",
            CommandDefinition.of(
                (aggregate, command, services) -> {
                  JsonNode peerGroup =
                      services
                          .app()
                          .context(PLANNING)
                          .aggregate(PEER_GROUP)
                          .read(UUID.fromString(command.data().path("id").asText()))
                          .state();
                  services.logger().info("Read peer group {}", command.data().path("id"));
                  aggregate
                      .events()
                      .publish(
                          "executed",
                          Jsons.object().put("participants", peerGroup.path("participants").size()));
                  return HandlerResult.next();
                }))
        .event(
            "executed",
            (aggregate, event) ->
                aggregate
                    .state()
                    .put("executed", aggregate.state().path("executed").asInt() + 1))
        .build();
  }

  private static HandlerResult joinAsUser(
      CommandAggregate aggregate, Command command, CommandServices services) {
    aggregate.events().publish("joined", Jsons.object().put("participant", command.user().id()));
    return HandlerResult.next();
  }

  private static HandlerResult execute(
      CommandAggregate aggregate, Command command, CommandServices services) {
    aggregate.events().publish("executed");
    return HandlerResult.next();
  }
}
