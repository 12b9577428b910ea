package io.httpscript.parser;

/**
 * A 1-based line/column location inside a script source.
 */
public record Position(int line, int col) {

  public Position {
    if (line < 0 || col < 0) {
      throw new IllegalArgumentException("line and col must not be negative");
    }
  }

  @Override
  public String toString() {
    return line + ":" + col;
  }
}
