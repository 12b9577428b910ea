package io.httpscript.parser;

import java.util.List;
import java.util.Objects;

/**
 * Unprocessed text of a target, header value, body or variable declaration.
 *
 * <p>Values without placeholders are used verbatim. Values with placeholders keep the template
 * text together with the placeholders in order of appearance; substitution replaces the first
 * remaining occurrence of each placeholder, left to right.
 */
public sealed interface Value permits Value.WithInline, Value.WithoutInline {

  String value();

  Selection selection();

  default List<InlineScript> inlineScripts() {
    return List.of();
  }

  static Value of(String value, List<InlineScript> inlineScripts, Selection selection) {
    if (inlineScripts == null || inlineScripts.isEmpty()) {
      return new WithoutInline(value, selection);
    }
    return new WithInline(value, inlineScripts, selection);
  }

  record WithInline(String value, List<InlineScript> inlineScripts, Selection selection) implements Value {

    public WithInline {
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(selection, "selection");
      inlineScripts = List.copyOf(inlineScripts);
      if (inlineScripts.isEmpty()) {
        throw new IllegalArgumentException("inlineScripts must not be empty");
      }
    }
  }

  record WithoutInline(String value, Selection selection) implements Value {

    public WithoutInline {
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(selection, "selection");
    }
  }
}
