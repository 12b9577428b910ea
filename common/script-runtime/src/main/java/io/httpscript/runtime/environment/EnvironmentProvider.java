package io.httpscript.runtime.environment;

import java.util.Map;

/**
 * Source of the values a run starts from and sink of the state it leaves behind.
 */
public interface EnvironmentProvider {

  /**
   * Read-only values of the selected environment.
   */
  Map<String, Object> environment();

  /**
   * Persisted values carried over from the previous run.
   */
  Map<String, Object> snapshot();

  /**
   * Stores the persisted values at the end of a run. Called once per run.
   */
  void save(Map<String, Object> snapshot);
}
