package io.httpscript.runtime.scripting;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * The {@code get/set/clear/clearAll/isEmpty} accessor behind {@code client.global} and
 * {@code request.variables}.
 */
final class VariablesBinding {

  private final VariableStore store;
  private final VariableStore fallback;

  /**
   * @param fallback store consulted by {@code get} when {@code store} has no value, may be null
   */
  VariablesBinding(VariableStore store, VariableStore fallback) {
    this.store = store;
    this.fallback = fallback;
  }

  Optional<Object> get(String name) {
    Optional<Object> value = store.get(name);
    if (value.isEmpty() && fallback != null) {
      return fallback.get(name);
    }
    return value;
  }

  ProxyObject toGuest() {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("get", (ProxyExecutable) args -> get(name(args, "get")).map(JsValues::toGuest).orElse(null));
    members.put("set", (ProxyExecutable) args -> {
      String name = name(args, "set");
      store.set(name, args.length > 1 ? JsValues.toJava(args[1]) : null);
      return null;
    });
    members.put("clear", (ProxyExecutable) args -> {
      store.remove(name(args, "clear"));
      return null;
    });
    members.put("clearAll", (ProxyExecutable) args -> {
      store.clear();
      return null;
    });
    members.put("isEmpty", (ProxyExecutable) args -> store.isEmpty());
    return ProxyObject.fromMap(members);
  }

  private String name(Value[] args, String function) {
    if (args.length == 0 || !args[0].isString()) {
      throw new IllegalArgumentException(store.name() + " variables: " + function + " expects a variable name");
    }
    return args[0].asString();
  }
}
