package dev.openclaw.jobs.execution;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class HandlerRegistry {

  private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

  public HandlerRegistry register(String kind, JobHandler handler) {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
    if (handlers.putIfAbsent(kind, handler) != null) {
      throw new IllegalStateException("A handler is already registered for kind " + kind);
    }
    return this;
  }

  public Optional<JobHandler> find(String kind) {
    return Optional.ofNullable(handlers.get(kind));
  }

  public Set<String> kinds() {
    return Set.copyOf(handlers.keySet());
  }
}
