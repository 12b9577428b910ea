package io.httpscript.runtime.scripting;

import io.httpscript.parser.Selection;

/**
 * A script failed outside of a {@code client.test} callback.
 */
public class ScriptExecutionException extends RuntimeException {

  private final Selection selection;

  public ScriptExecutionException(String message, Selection selection, Throwable cause) {
    super(selection.isNone() ? message : selection + ": " + message, cause);
    this.selection = selection;
  }

  public Selection selection() {
    return selection;
  }
}
