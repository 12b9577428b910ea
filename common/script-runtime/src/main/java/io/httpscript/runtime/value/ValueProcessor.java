package io.httpscript.runtime.value;

import io.httpscript.parser.InlineScript;
import io.httpscript.parser.Value;
import io.httpscript.runtime.scripting.ScriptEngine;
import java.util.Optional;
import java.util.function.Function;

/**
 * Substitutes placeholders in values.
 *
 * <p>Placeholders are handled in order of appearance. Each one replaces only the first remaining
 * occurrence of its placeholder text, so two {@code {{$random.uuid}}} placeholders in one value
 * get independent values.
 */
public final class ValueProcessor {

  private ValueProcessor() {
  }

  /**
   * Resolves every placeholder through {@link ScriptEngine#resolveRequestVariable(String)}.
   * Values without placeholders are returned unchanged.
   *
   * @throws io.httpscript.runtime.scripting.ScriptExecutionException when a script fragment fails
   */
  public static ProcessedValue process(ScriptEngine engine, Value value) {
    return substitute(value, inline -> Optional.of(engine.resolveRequestVariable(inline.script())));
  }

  /**
   * Resolves placeholders with the given resolver; placeholders it returns empty for stay as they
   * are.
   */
  public static ProcessedValue substitute(Value value, Function<InlineScript, Optional<String>> resolver) {
    if (value instanceof Value.WithoutInline) {
      return new ProcessedValue(value.value());
    }
    String result = value.value();
    for (InlineScript inline : value.inlineScripts()) {
      Optional<String> resolved = resolver.apply(inline);
      if (resolved.isPresent()) {
        result = replaceFirst(result, inline.placeholder(), resolved.get());
      }
    }
    return new ProcessedValue(result);
  }

  private static String replaceFirst(String text, String placeholder, String replacement) {
    int index = text.indexOf(placeholder);
    if (index < 0) {
      return text;
    }
    return text.substring(0, index) + replacement + text.substring(index + placeholder.length());
  }
}
