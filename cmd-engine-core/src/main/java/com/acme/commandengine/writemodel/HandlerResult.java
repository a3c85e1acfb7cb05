package com.acme.commandengine.writemodel;

import java.util.Objects;

/** What a command-handling step decided. A rejection stops the chain. */
public sealed interface HandlerResult permits HandlerResult.Next, HandlerResult.Rejected {

  static HandlerResult next() {
    return Next.INSTANCE;
  }

  static HandlerResult reject(String reason) {
    return new Rejected(reason);
  }

  final class Next implements HandlerResult {
    private static final Next INSTANCE = new Next();

    private Next() {}

    @Override
    public String toString() {
      return "Next";
    }
  }

  record Rejected(String reason) implements HandlerResult {
    public Rejected {
      Objects.requireNonNull(reason, "Reason is missing.");
    }
  }
}
