package io.httpscript.parser;

import java.util.Objects;

public record Header(String fieldName, Value fieldValue, Selection selection) {

  public Header {
    Objects.requireNonNull(fieldName, "fieldName");
    Objects.requireNonNull(fieldValue, "fieldValue");
    Objects.requireNonNull(selection, "selection");
  }
}
