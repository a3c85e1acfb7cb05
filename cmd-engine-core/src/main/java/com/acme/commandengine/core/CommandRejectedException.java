package com.acme.commandengine.core;

/** Expected, domain-level refusal: business rule, access denial or an explicit rejection. */
public final class CommandRejectedException extends CommandException {
  public CommandRejectedException(String reason) {
    super(reason);
  }

  @Override
  public String eventNameSuffix() {
    return "Rejected";
  }
}
