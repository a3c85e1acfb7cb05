package com.acme.commandengine.writemodel;

import com.acme.commandengine.aggregate.ReadOnlyAggregate;
import com.acme.commandengine.domain.Command;

/** Decides, before handling, whether a guarded command may run at all. */
@FunctionalInterface
public interface AuthorizationCheck {
  boolean isAuthorized(ReadOnlyAggregate aggregate, Command command, CommandServices services)
      throws Exception;

  static AuthorizationCheck forPublic() {
    return (aggregate, command, services) -> true;
  }

  static AuthorizationCheck forAuthenticated() {
    return (aggregate, command, services) -> command.user().isAuthenticated();
  }
}
