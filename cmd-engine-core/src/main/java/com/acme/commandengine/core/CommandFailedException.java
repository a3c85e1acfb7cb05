package com.acme.commandengine.core;

/** Anything that went wrong which is not a deliberate rejection. */
public final class CommandFailedException extends CommandException {
  public CommandFailedException(String message) {
    super(message);
  }

  public CommandFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String eventNameSuffix() {
    return "Failed";
  }
}
