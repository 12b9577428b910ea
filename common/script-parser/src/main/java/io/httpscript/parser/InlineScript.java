package io.httpscript.parser;

import java.util.Objects;

/**
 * A placeholder found inside a value.
 *
 * @param script      trimmed text between the delimiters: a variable name, a {@code $} generator
 *                    reference or a JavaScript expression
 * @param placeholder the exact delimited text that gets replaced, e.g. {@code {{ host }}}
 * @param selection   where the placeholder sits in the source
 */
public record InlineScript(String script, String placeholder, Selection selection) {

  public InlineScript {
    Objects.requireNonNull(script, "script");
    Objects.requireNonNull(placeholder, "placeholder");
    Objects.requireNonNull(selection, "selection");
  }
}
