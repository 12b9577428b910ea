package io.httpscript.parser;

/**
 * Thrown when a script does not match the grammar or is structurally incomplete.
 */
public class ScriptParseException extends RuntimeException {

  private final Selection selection;

  public ScriptParseException(String message, Selection selection) {
    super(selection + ": " + message);
    this.selection = selection;
  }

  public Selection selection() {
    return selection;
  }
}
