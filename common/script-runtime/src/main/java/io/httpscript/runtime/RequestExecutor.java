package io.httpscript.runtime;

import io.httpscript.parser.Header;
import io.httpscript.parser.Request;
import io.httpscript.parser.RequestScript;
import io.httpscript.parser.VariableDeclaration;
import io.httpscript.runtime.http.HeaderField;
import io.httpscript.runtime.http.HttpClient;
import io.httpscript.runtime.http.HttpResponse;
import io.httpscript.runtime.http.ResolvedRequest;
import io.httpscript.runtime.output.Output;
import io.httpscript.runtime.scripting.Script;
import io.httpscript.runtime.scripting.ScriptEngine;
import io.httpscript.runtime.scripting.TestsReport;
import io.httpscript.runtime.source.SourceItem;
import io.httpscript.runtime.value.ValueProcessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single request script: declare variables, pre-request handler, resolve, send, response
 * handler. Phases run strictly in that order; missing handlers are skipped.
 */
public final class RequestExecutor {

  private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

  private final ScriptEngine engine;
  private final HttpClient client;
  private final Output output;

  public RequestExecutor(ScriptEngine engine, HttpClient client, Output output) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.client = Objects.requireNonNull(client, "client");
    this.output = Objects.requireNonNull(output, "output");
  }

  /**
   * @throws RequestExecutionException when a script fails outside of a test or the exchange fails
   */
  public RequestOutcome execute(SourceItem item) {
    RequestScript script = item.script();
    String name = item.displayName();

    Phase phase = Phase.DECLARE_VARIABLES;
    try {
      for (VariableDeclaration variable : script.requestVariables()) {
        engine.defineVariable(variable.name(), ValueProcessor.process(engine, variable.value()).value());
      }

      phase = Phase.PRE_REQUEST;
      if (script.preRequestHandler() != null) {
        engine.preHandle(Script.of(script.preRequestHandler()), script.request());
      }

      phase = Phase.RESOLVE_REQUEST;
      ResolvedRequest request = resolve(script.request());

      phase = Phase.SEND;
      output.request(request, name);
      log.debug("Sending {} for [{}]", request.requestLine(), name);
      HttpResponse response = client.execute(request);
      log.debug("Received {} for [{}]", response.statusLine(), name);

      phase = Phase.HANDLE_RESPONSE;
      TestsReport report = TestsReport.empty();
      if (script.handler() != null) {
        engine.handle(Script.of(script.handler()), response);
        report = engine.report();
      }
      output.response(response, report);
      return new RequestOutcome(name, report);
    } catch (RuntimeException ex) {
      throw new RequestExecutionException(name, phase.description, ex);
    }
  }

  private ResolvedRequest resolve(Request request) {
    String target = ValueProcessor.process(engine, request.target()).withoutWhitespace().value();
    List<HeaderField> headers = new ArrayList<>();
    for (Header header : request.headers()) {
      headers.add(new HeaderField(header.fieldName(), ValueProcessor.process(engine, header.fieldValue()).value()));
    }
    String body = request.body() == null ? null : ValueProcessor.process(engine, request.body()).value();
    return new ResolvedRequest(request.method(), target, headers, body);
  }

  private enum Phase {
    DECLARE_VARIABLES("Failed to declare request variables"),
    PRE_REQUEST("Pre-request handler failed"),
    RESOLVE_REQUEST("Failed to resolve request"),
    SEND("Request failed"),
    HANDLE_RESPONSE("Response handler failed");

    private final String description;

    Phase(String description) {
      this.description = description;
    }
  }
}
