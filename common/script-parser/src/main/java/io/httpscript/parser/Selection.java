package io.httpscript.parser;

import java.util.Objects;

/**
 * Source range of a syntax node, used for diagnostics only.
 */
public record Selection(String filename, Position start, Position end) {

  private static final Position NOWHERE = new Position(0, 0);

  public Selection {
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  /**
   * Selection for scripts that do not originate from a parsed file.
   */
  public static Selection none() {
    return new Selection("", NOWHERE, NOWHERE);
  }

  public boolean isNone() {
    return filename.isEmpty() && NOWHERE.equals(start);
  }

  @Override
  public String toString() {
    if (isNone()) {
      return "<inline>";
    }
    return filename + ":" + start;
  }
}
