package io.httpscript.runtime.scripting;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named container of script variables. Values are plain Java data: strings, numbers, booleans,
 * lists and maps. {@code null} is never stored.
 */
final class VariableStore {

  private final String name;
  private final Map<String, Object> values = new LinkedHashMap<>();

  VariableStore(String name) {
    this.name = name;
  }

  VariableStore(String name, Map<String, ?> initial) {
    this(name);
    initial.forEach(this::set);
  }

  String name() {
    return name;
  }

  Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  void set(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value != null) {
      values.put(key, value);
    }
  }

  void remove(String key) {
    values.remove(key);
  }

  void clear() {
    values.clear();
  }

  boolean isEmpty() {
    return values.isEmpty();
  }

  Map<String, Object> snapshot() {
    return new LinkedHashMap<>(values);
  }
}
