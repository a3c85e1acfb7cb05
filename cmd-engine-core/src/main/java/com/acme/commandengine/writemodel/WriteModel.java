package com.acme.commandengine.writemodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The declarative definition of every context and aggregate type. Built once at startup and
 * passed to the components that need it; immutable afterwards.
 */
public final class WriteModel {
  private final Map<String, Map<String, AggregateDefinition>> contexts;

  private WriteModel(Map<String, Map<String, AggregateDefinition>> contexts) {
    Map<String, Map<String, AggregateDefinition>> copy = new LinkedHashMap<>();
    contexts.forEach(
        (name, aggregates) ->
            copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(aggregates))));
    this.contexts = Collections.unmodifiableMap(copy);
  }

  public boolean hasContext(String contextName) {
    return contextName != null && contexts.containsKey(contextName);
  }

  public Optional<AggregateDefinition> findAggregate(String contextName, String aggregateName) {
    if (contextName == null || aggregateName == null) {
      return Optional.empty();
    }
    Map<String, AggregateDefinition> aggregates = contexts.get(contextName);
    return aggregates == null ? Optional.empty() : Optional.ofNullable(aggregates.get(aggregateName));
  }

  /** @throws IllegalArgumentException if the context or aggregate is not defined */
  public AggregateDefinition aggregate(String contextName, String aggregateName) {
    if (!hasContext(contextName)) {
      throw new IllegalArgumentException("Invalid context name.");
    }
    return findAggregate(contextName, aggregateName)
        .orElseThrow(() -> new IllegalArgumentException("Invalid aggregate name."));
  }

  public Map<String, Map<String, AggregateDefinition>> contexts() {
    return contexts;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Map<String, AggregateDefinition>> contexts = new LinkedHashMap<>();

    private Builder() {}

    public Builder aggregate(
        String contextName, String aggregateName, AggregateDefinition definition) {
      contexts.computeIfAbsent(contextName, k -> new LinkedHashMap<>()).put(aggregateName, definition);
      return this;
    }

    public WriteModel build() {
      return new WriteModel(contexts);
    }
  }
}
