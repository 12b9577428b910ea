package io.httpscript.parser;

import java.util.Objects;

/**
 * JavaScript source of a {@code < {% %}} pre-request or {@code > {% %}} response handler.
 */
public record Handler(String script, Selection selection) {

  public Handler {
    Objects.requireNonNull(script, "script");
    Objects.requireNonNull(selection, "selection");
  }
}
