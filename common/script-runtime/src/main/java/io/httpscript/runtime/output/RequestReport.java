package io.httpscript.runtime.output;

import io.httpscript.runtime.scripting.TestsReport;
import java.util.Objects;

/**
 * Tests of one executed request, as handed to {@link Output#tests}.
 *
 * @param sourceName  file or source the request came from
 * @param requestName declared name, or {@code #n} for unnamed requests
 */
public record RequestReport(String sourceName, String requestName, TestsReport report) {

  public RequestReport {
    Objects.requireNonNull(sourceName, "sourceName");
    Objects.requireNonNull(requestName, "requestName");
    Objects.requireNonNull(report, "report");
  }

  public String displayName() {
    return sourceName + " / " + requestName;
  }
}
