package io.httpscript.runtime.output;

import io.httpscript.runtime.http.HttpResponse;
import io.httpscript.runtime.http.ResolvedRequest;
import io.httpscript.runtime.scripting.TestsReport;
import java.util.List;

/**
 * Presentation of a run. Events arrive in order: {@code request} before each send,
 * {@code response} after the response handler ran, {@code tests} once at the end.
 */
public interface Output {

  void request(ResolvedRequest request, String displayName);

  void response(HttpResponse response, TestsReport report);

  default void tests(List<RequestReport> reports) {
  }

  /**
   * Process exit status this output suggests for the finished run.
   */
  default int exitCode() {
    return 0;
  }
}
