package com.acme.commandengine.aggregate;

import com.acme.commandengine.core.InvalidAuthorizationException;
import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.core.MissingDataException;
import com.acme.commandengine.writemodel.AggregateDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/** Checks an {@code authorize} payload against the aggregate's commands, events and options. */
final class AuthorizationPayload {
  static final Set<String> OPTIONS = Set.of("forAuthenticated", "forPublic");

  private AuthorizationPayload() {}

  /** @return a copy holding only the validated {@code commands} and {@code events} sections */
  static ObjectNode validate(JsonNode data, AggregateDefinition definition) {
    JsonNode commands = data == null ? null : data.get("commands");
    JsonNode events = data == null ? null : data.get("events");
    if (isAbsent(commands) && isAbsent(events)) {
      throw new MissingDataException("Commands and events are missing.");
    }

    ObjectNode payload = Jsons.object();
    if (!isAbsent(commands)) {
      validateSection(commands, definition::hasCommand, "Command is missing.", "Unknown command.");
      payload.set("commands", commands.deepCopy());
    }
    if (!isAbsent(events)) {
      validateSection(events, definition::hasEvent, "Event is missing.", "Unknown event.");
      payload.set("events", events.deepCopy());
    }
    return payload;
  }

  private static void validateSection(
      JsonNode section, Predicate<String> isKnown, String missingMessage, String unknownMessage) {
    if (!section.isObject()) {
      throw new InvalidAuthorizationException("Invalid authorization option.");
    }
    if (section.size() == 0) {
      throw new MissingDataException(missingMessage);
    }
    Iterator<Map.Entry<String, JsonNode>> entries = section.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> entry = entries.next();
      if (!isKnown.test(entry.getKey())) {
        throw new InvalidAuthorizationException(unknownMessage);
      }
      validateOptions(entry.getValue());
    }
  }

  private static void validateOptions(JsonNode options) {
    if (options == null || !options.isObject() || options.size() == 0) {
      throw new InvalidAuthorizationException("Missing authorization options.");
    }
    Iterator<Map.Entry<String, JsonNode>> entries = options.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> option = entries.next();
      if (!OPTIONS.contains(option.getKey())) {
        throw new InvalidAuthorizationException("Unknown authorization option.");
      }
      if (!option.getValue().isBoolean()) {
        throw new InvalidAuthorizationException("Invalid authorization option.");
      }
    }
  }

  private static boolean isAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }
}
