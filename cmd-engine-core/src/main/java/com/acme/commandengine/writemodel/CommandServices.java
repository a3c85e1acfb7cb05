package com.acme.commandengine.writemodel;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;

/**
 * Services handed to command handlers and authorization checks. A fresh bundle is built for every
 * command.
 *
 * @param app read access to the current state of any aggregate in the write model
 * @param client what the inbound transport reported about the sender of the command
 * @param logger logger named after the aggregate's write-model location
 */
public record CommandServices(ApplicationReader app, JsonNode client, Logger logger) {}
