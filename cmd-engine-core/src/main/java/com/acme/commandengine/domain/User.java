package com.acme.commandengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The acting identity of a command: a subject id plus the decoded token claims it was
 * authenticated with.
 */
public record User(String id, Map<String, Object> token) {
  public static final String ANONYMOUS_ID = "anonymous";
  public static final String CAN_IMPERSONATE_CLAIM = "can-impersonate";

  public User {
    Objects.requireNonNull(id, "User id is missing.");
    // decoded tokens may carry null claims
    token = token == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(token));
  }

  public static User of(String id) {
    return new User(id, Map.of("sub", id));
  }

  public static User anonymous() {
    return of(ANONYMOUS_ID);
  }

  @JsonIgnore
  public boolean isAuthenticated() {
    return !ANONYMOUS_ID.equals(id);
  }

  @JsonIgnore
  public boolean canImpersonate() {
    return Boolean.TRUE.equals(token.get(CAN_IMPERSONATE_CLAIM));
  }
}
