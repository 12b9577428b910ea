package io.httpscript.runtime.source;

import io.httpscript.parser.RequestScript;
import java.util.Objects;

/**
 * One request script to execute.
 *
 * @param sourceName name of the file or source the script belongs to
 * @param index      0-based position of the script inside its source
 */
public record SourceItem(String sourceName, int index, RequestScript script) {

  public SourceItem {
    Objects.requireNonNull(sourceName, "sourceName");
    Objects.requireNonNull(script, "script");
  }

  /**
   * The declared name, or {@code #n} with the 1-based position for unnamed scripts.
   */
  public String requestName() {
    return script.optionalName().orElse("#" + (index + 1));
  }

  public String displayName() {
    return sourceName + " / " + requestName();
  }
}
