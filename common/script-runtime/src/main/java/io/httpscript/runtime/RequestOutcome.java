package io.httpscript.runtime;

import io.httpscript.runtime.scripting.TestsReport;
import java.util.Objects;

/**
 * Result of executing one request script.
 *
 * @param displayName {@code "<source> / <name or #n>"}
 */
public record RequestOutcome(String displayName, TestsReport report) {

  public RequestOutcome {
    Objects.requireNonNull(displayName, "displayName");
    Objects.requireNonNull(report, "report");
  }
}
