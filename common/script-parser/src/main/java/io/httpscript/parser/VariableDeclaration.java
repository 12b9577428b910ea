package io.httpscript.parser;

import java.util.Objects;

/**
 * An {@code @name = value} line at the top of a request section.
 */
public record VariableDeclaration(String name, Value value, Selection selection) {

  public VariableDeclaration {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(selection, "selection");
  }
}
