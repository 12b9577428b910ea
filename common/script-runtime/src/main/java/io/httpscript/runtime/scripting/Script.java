package io.httpscript.runtime.scripting;

import io.httpscript.parser.Handler;
import io.httpscript.parser.Selection;
import java.util.Objects;

/**
 * JavaScript source together with where it came from.
 */
public record Script(String source, Selection selection) {

  public Script {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(selection, "selection");
  }

  public static Script of(Handler handler) {
    return new Script(handler.script(), handler.selection());
  }

  public static Script inline(String source) {
    return new Script(source, Selection.none());
  }
}
