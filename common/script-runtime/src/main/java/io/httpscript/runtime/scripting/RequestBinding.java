package io.httpscript.runtime.scripting;

import io.httpscript.parser.Header;
import io.httpscript.parser.InlineScript;
import io.httpscript.parser.Request;
import io.httpscript.parser.Value;
import io.httpscript.runtime.value.ValueProcessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * The {@code request} object of pre-request handlers.
 *
 * <p>{@code getRaw()} accessors return the text as written. {@code tryGetSubstituted()} accessors
 * substitute what can be known without running scripts: stored variables and argument-checked
 * generator calls. Anything else keeps its placeholder.
 */
final class RequestBinding {

  private final Request request;
  private final VariablesBinding variables;
  private final VariableStore requestVariables;
  private final VariableStore persisted;
  private final VariableStore environment;
  private final RandomGenerators generators;

  RequestBinding(Request request,
                 VariableStore requestVariables,
                 VariableStore persisted,
                 VariableStore environment,
                 RandomGenerators generators) {
    this.request = request;
    this.requestVariables = requestVariables;
    this.persisted = persisted;
    this.environment = environment;
    this.generators = generators;
    this.variables = new VariablesBinding(requestVariables, null);
  }

  ProxyObject toGuest() {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("method", request.method().name());
    members.put("url", valueObject(request.target(), "getRaw", "tryGetSubstituted"));
    members.put("body", request.optionalBody()
        .map(body -> valueObject(body, "getRaw", "tryGetSubstituted"))
        .orElseGet(this::emptyBody));
    members.put("headers", headers());
    members.put("variables", variables.toGuest());
    members.put("environment", ProxyObject.fromMap(Map.of(
        "get", (ProxyExecutable) args -> args.length == 0 || !args[0].isString()
            ? null
            : environment.get(args[0].asString()).map(JsValues::toGuest).orElse(null))));
    return ProxyObject.fromMap(members);
  }

  /**
   * Best-effort substitution used by {@code tryGetSubstituted()}.
   */
  String tryGetSubstituted(Value value) {
    return ValueProcessor.substitute(value, this::resolveWithoutScripts).value();
  }

  private Optional<String> resolveWithoutScripts(InlineScript inline) {
    String script = inline.script();
    if (script.startsWith("$")) {
      try {
        return GeneratorCall.parse(script).map(call -> call.evaluate(generators));
      } catch (IllegalArgumentException ex) {
        return Optional.empty();
      }
    }
    Optional<Object> value = requestVariables.get(script);
    if (value.isEmpty()) {
      value = persisted.get(script);
    }
    if (value.isEmpty()) {
      value = environment.get(script);
    }
    return value.map(JsValues::toText);
  }

  private ProxyObject headers() {
    List<Object> all = new ArrayList<>();
    for (Header header : request.headers()) {
      all.add(headerObject(header));
    }
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("all", (ProxyExecutable) args -> ProxyArray.fromList(new ArrayList<>(all)));
    members.put("findByName", (ProxyExecutable) args -> {
      if (args.length == 0 || !args[0].isString()) {
        return null;
      }
      String name = args[0].asString();
      for (int i = 0; i < request.headers().size(); i++) {
        if (request.headers().get(i).fieldName().equalsIgnoreCase(name)) {
          return all.get(i);
        }
      }
      return null;
    });
    return ProxyObject.fromMap(members);
  }

  private ProxyObject headerObject(Header header) {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("name", header.fieldName());
    members.putAll(valueMembers(header.fieldValue(), "getRawValue", "tryGetSubstitutedValue"));
    return ProxyObject.fromMap(members);
  }

  private ProxyObject valueObject(Value value, String raw, String substituted) {
    return ProxyObject.fromMap(valueMembers(value, raw, substituted));
  }

  private Map<String, Object> valueMembers(Value value, String raw, String substituted) {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put(raw, (ProxyExecutable) args -> value.value());
    members.put(substituted, (ProxyExecutable) args -> tryGetSubstituted(value));
    return members;
  }

  private ProxyObject emptyBody() {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("getRaw", (ProxyExecutable) args -> null);
    members.put("tryGetSubstituted", (ProxyExecutable) args -> null);
    return ProxyObject.fromMap(members);
  }
}
