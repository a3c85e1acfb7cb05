package com.acme.commandengine.core;

/**
 * Terminal outcome of a command that did not produce committed events. The two subclasses are the
 * only classifications a pipeline run can end with; callers switch on the type, never on the
 * message.
 */
public abstract sealed class CommandException extends RuntimeException
    permits CommandRejectedException, CommandFailedException {

  protected CommandException(String message) {
    super(message);
  }

  protected CommandException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Suffix appended to the command name to build the outcome event's name. */
  public abstract String eventNameSuffix();

  /**
   * @return the human-readable reason published with the outcome event: the cause's message if a
   *     cause is present, otherwise this exception's message
   */
  public String reason() {
    Throwable cause = getCause();
    if (cause != null && cause.getMessage() != null) {
      return cause.getMessage();
    }
    return getMessage();
  }
}
