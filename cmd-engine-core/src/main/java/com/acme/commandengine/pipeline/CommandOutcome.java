package com.acme.commandengine.pipeline;

import com.acme.commandengine.domain.Command;
import com.acme.commandengine.domain.Event;
import java.util.List;

/**
 * How a pipeline run ended.
 *
 * @param command the command as executed, after impersonation
 * @param events the committed events, or the single published rejection/failure event
 * @param reason null when handled
 */
public record CommandOutcome(Command command, Status status, List<Event> events, String reason) {

  public enum Status {
    HANDLED,
    REJECTED,
    FAILED
  }

  public CommandOutcome {
    events = List.copyOf(events);
  }

  public static CommandOutcome handled(Command command, List<Event> events) {
    return new CommandOutcome(command, Status.HANDLED, events, null);
  }

  public static CommandOutcome rejected(Command command, Event outcome, String reason) {
    return new CommandOutcome(command, Status.REJECTED, List.of(outcome), reason);
  }

  public static CommandOutcome failed(Command command, Event outcome, String reason) {
    return new CommandOutcome(command, Status.FAILED, List.of(outcome), reason);
  }

  public boolean isHandled() {
    return status == Status.HANDLED;
  }
}
