package io.httpscript.runtime.environment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory provider; the last saved snapshot becomes the snapshot of the next run.
 */
public final class StaticEnvironmentProvider implements EnvironmentProvider {

  private final Map<String, Object> environment;
  private Map<String, Object> snapshot;

  public StaticEnvironmentProvider(Map<String, ?> environment) {
    this(environment, Map.of());
  }

  public StaticEnvironmentProvider(Map<String, ?> environment, Map<String, ?> snapshot) {
    this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    this.snapshot = new LinkedHashMap<>(Objects.requireNonNull(snapshot, "snapshot"));
  }

  @Override
  public Map<String, Object> environment() {
    return environment;
  }

  @Override
  public Map<String, Object> snapshot() {
    return new LinkedHashMap<>(snapshot);
  }

  @Override
  public void save(Map<String, Object> snapshot) {
    this.snapshot = new LinkedHashMap<>(snapshot);
  }
}
