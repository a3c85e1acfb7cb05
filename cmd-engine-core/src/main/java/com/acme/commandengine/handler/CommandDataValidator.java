package com.acme.commandengine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Validates command data against the JSON schema of a guarded command definition (draft 7). */
public class CommandDataValidator {
  private final JsonSchemaFactory schemaFactory =
      JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
  private final Map<JsonNode, JsonSchema> compiled = new ConcurrentHashMap<>();

  /** @throws IllegalArgumentException carrying the validator messages if {@code data} is invalid */
  public void validate(JsonNode schema, JsonNode data) {
    JsonSchema jsonSchema = compiled.computeIfAbsent(schema, schemaFactory::getSchema);
    Set<ValidationMessage> messages = jsonSchema.validate(data);
    if (!messages.isEmpty()) {
      throw new IllegalArgumentException(
          messages.stream()
              .map(ValidationMessage::getMessage)
              .sorted()
              .collect(Collectors.joining(", ")));
    }
  }
}
