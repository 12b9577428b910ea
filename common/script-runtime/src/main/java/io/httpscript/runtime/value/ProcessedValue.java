package io.httpscript.runtime.value;

import java.util.Objects;

/**
 * Fully resolved text of a {@link io.httpscript.parser.Value}.
 */
public record ProcessedValue(String value) {

  public ProcessedValue {
    Objects.requireNonNull(value, "value");
  }

  /**
   * The value with every whitespace character removed, as required for request targets that
   * span several lines.
   */
  public ProcessedValue withoutWhitespace() {
    return new ProcessedValue(value.replaceAll("\\s", ""));
  }

  @Override
  public String toString() {
    return value;
  }
}
