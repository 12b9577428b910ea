package io.httpscript.runtime;

import io.httpscript.runtime.environment.EnvironmentProvider;
import io.httpscript.runtime.http.HttpClient;
import io.httpscript.runtime.output.Output;
import io.httpscript.runtime.output.RequestReport;
import io.httpscript.runtime.scripting.ScriptEngine;
import io.httpscript.runtime.scripting.TestResult;
import io.httpscript.runtime.source.SourceItem;
import io.httpscript.runtime.source.SourceProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes request scripts one after another against a single scripting host.
 *
 * <p>The host is reset after every request, so only values written to {@code client.global}
 * travel from one request to the next. The persisted store is saved once, after the last
 * request. Failed tests do not stop the run; they are reported together at the end.
 */
public final class ScriptRuntime {

  private static final Logger log = LoggerFactory.getLogger(ScriptRuntime.class);

  private final ScriptEngine engine;
  private final RequestExecutor executor;
  private final Output output;
  private final EnvironmentProvider environment;

  public ScriptRuntime(ScriptEngine engine, HttpClient client, Output output, EnvironmentProvider environment) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.output = Objects.requireNonNull(output, "output");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.executor = new RequestExecutor(engine, client, output);
  }

  /**
   * Runs every request script of the source.
   *
   * @return number of executed requests
   * @throws TestFailuresException      when every request ran but some tests failed
   * @throws RequestExecutionException  when a request could not be executed; remaining requests
   *                                    are skipped and nothing is saved
   */
  public int execute(SourceProvider source) {
    List<SourceItem> items = source.requestScripts();
    List<RequestReport> reports = new ArrayList<>();
    List<TestFailuresException.FailedTest> failures = new ArrayList<>();

    for (SourceItem item : items) {
      log.info("Executing [{}]", item.displayName());
      RequestOutcome outcome = executor.execute(item);
      reports.add(new RequestReport(item.sourceName(), item.requestName(), outcome.report()));
      for (Map.Entry<String, TestResult.Failure> failed : outcome.report().failed().entrySet()) {
        failures.add(new TestFailuresException.FailedTest(
            outcome.displayName(), failed.getKey(), failed.getValue().error()));
      }
      engine.reset();
    }

    output.tests(reports);
    environment.save(engine.snapshot());
    log.info("Executed {} request(s), {} failed test(s)", items.size(), failures.size());

    if (!failures.isEmpty()) {
      throw new TestFailuresException(failures);
    }
    return items.size();
  }
}
