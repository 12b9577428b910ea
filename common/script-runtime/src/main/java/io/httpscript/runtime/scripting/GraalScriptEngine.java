package io.httpscript.runtime.scripting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.httpscript.parser.Request;
import io.httpscript.runtime.http.HeaderField;
import io.httpscript.runtime.http.HttpResponse;
import java.io.IOException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ScriptEngine} backed by GraalJS.
 *
 * <p>Each reset closes the current polyglot context and opens a new one on the same engine, seeded
 * with the persisted store only. Global variables a handler created are gone afterwards.
 */
public final class GraalScriptEngine implements ScriptEngine {

  private static final Logger log = LoggerFactory.getLogger(GraalScriptEngine.class);

  private static final String LANGUAGE = "js";
  private static final String RESERVED_CLIENT = "client";
  private static final Source GENERATORS = loadPrelude("generators.js");

  private final Engine engine;
  private final ScriptConsole console;
  private final RandomGenerators generators = new RandomGenerators();
  private final ObjectMapper mapper = JsValues.mapper();
  private final VariableStore environment;

  private VariableStore persisted;
  private VariableStore requestVariables;
  private Map<String, TestResult> tests;
  private Context context;

  public GraalScriptEngine(Map<String, ?> environment, Map<String, ?> snapshot) {
    this(environment, snapshot, ScriptConsole.logging());
  }

  /**
   * @param environment read-only values, typically the selected environment of an environment file
   * @param snapshot    persisted values carried over from a previous run
   * @param console     receives {@code client.log} output
   * @throws IllegalArgumentException when the environment defines {@code client}
   */
  public GraalScriptEngine(Map<String, ?> environment, Map<String, ?> snapshot, ScriptConsole console) {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(snapshot, "snapshot");
    this.console = Objects.requireNonNull(console, "console");
    if (environment.containsKey(RESERVED_CLIENT)) {
      throw new IllegalArgumentException("'" + RESERVED_CLIENT + "' is reserved and cannot be an environment variable");
    }
    this.environment = new VariableStore("environment", environment);
    this.engine = Engine.newBuilder()
        .option("engine.WarnInterpreterOnly", "false")
        .build();
    start(snapshot);
  }

  @Override
  public String executeScript(Script script) {
    Objects.requireNonNull(script, "script");
    String name = script.selection().isNone() ? "inline.js" : script.selection().toString();
    Source source = Source.newBuilder(LANGUAGE, script.source(), name).buildLiteral();
    try {
      return asString(context.eval(source));
    } catch (PolyglotException ex) {
      if (ex.isCancelled() || ex.isExit() || ex.isInternalError()) {
        throw ex;
      }
      throw new ScriptExecutionException(ClientBinding.message(ex), script.selection(), ex);
    }
  }

  @Override
  public String resolveRequestVariable(String script) {
    if (script.startsWith("$")) {
      return executeScript(Script.inline(script));
    }
    Optional<Object> value = requestVariables.get(script);
    if (value.isEmpty()) {
      value = persisted.get(script);
    }
    if (value.isEmpty()) {
      value = environment.get(script);
    }
    if (value.isEmpty()) {
      log.debug("Variable '{}' is not defined, keeping placeholder", script);
      return "{{" + script + "}}";
    }
    return JsValues.toText(value.get());
  }

  @Override
  public void defineVariable(String name, String value) {
    requestVariables.set(name, value);
  }

  @Override
  public void preHandle(Script script, Request request) {
    Objects.requireNonNull(request, "request");
    RequestBinding binding = new RequestBinding(request, requestVariables, persisted, environment, generators);
    runWith("request", binding.toGuest(), script);
  }

  @Override
  public void handle(Script script, HttpResponse response) {
    Objects.requireNonNull(response, "response");
    Value json = context.getBindings(LANGUAGE).getMember("JSON");
    Value guestResponse = json.invokeMember("parse", responseJson(response));
    runWith("response", guestResponse, script);
  }

  @Override
  public TestsReport report() {
    return TestsReport.of(tests);
  }

  @Override
  public void reset() {
    Map<String, Object> carried = snapshot();
    context.close();
    start(carried);
  }

  @Override
  public Map<String, Object> snapshot() {
    return persisted.snapshot();
  }

  @Override
  public void close() {
    context.close();
    engine.close();
  }

  private void start(Map<String, ?> snapshot) {
    this.persisted = new VariableStore("global", snapshot);
    this.requestVariables = new VariableStore("request");
    this.tests = new LinkedHashMap<>();
    this.context = Context.newBuilder(LANGUAGE)
        .engine(engine)
        .allowHostAccess(HostAccess.EXPLICIT)
        .build();
    ClientBinding client = new ClientBinding(console, tests::put, new VariablesBinding(persisted, environment));
    context.getBindings(LANGUAGE).putMember(RESERVED_CLIENT, client.toGuest());
    context.eval(GENERATORS).execute(new GeneratorBindings(generators));
  }

  private void runWith(String binding, Object value, Script script) {
    Value bindings = context.getBindings(LANGUAGE);
    bindings.putMember(binding, value);
    try {
      executeScript(script);
    } finally {
      bindings.removeMember(binding);
    }
  }

  private String responseJson(HttpResponse response) {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", response.statusCode());
    ObjectNode headers = node.putObject("headers");
    for (HeaderField header : response.headers()) {
      headers.put(header.name(), header.value());
    }
    String body = response.body();
    if (body == null) {
      node.putNull("body");
    } else {
      JsonNode parsed = tryParseJson(body);
      if (parsed != null && parsed.isObject()) {
        node.set("body", parsed);
      } else {
        node.put("body", body);
      }
    }
    return JsValues.toJson(node);
  }

  private JsonNode tryParseJson(String body) {
    try {
      return mapper.readTree(body);
    } catch (IOException ex) {
      return null;
    }
  }

  private String asString(Value value) {
    if (value.isString()) {
      return value.asString();
    }
    return context.getBindings(LANGUAGE).getMember("String").execute(value).asString();
  }

  private static Source loadPrelude(String resource) {
    URL url = GraalScriptEngine.class.getResource(resource);
    if (url == null) {
      throw new IllegalStateException("Missing script resource " + resource);
    }
    try {
      return Source.newBuilder(LANGUAGE, url).build();
    } catch (IOException ex) {
      throw new IllegalStateException("Cannot load script resource " + resource, ex);
    }
  }
}
