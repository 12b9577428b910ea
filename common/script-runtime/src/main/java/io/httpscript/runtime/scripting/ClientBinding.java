package io.httpscript.runtime.scripting;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * The global {@code client} object: {@code log}, {@code test}, {@code assert} and {@code global}.
 */
final class ClientBinding {

  private final ScriptConsole console;
  private final BiConsumer<String, TestResult> tests;
  private final VariablesBinding global;

  ClientBinding(ScriptConsole console, BiConsumer<String, TestResult> tests, VariablesBinding global) {
    this.console = console;
    this.tests = tests;
    this.global = global;
  }

  ProxyObject toGuest() {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("log", (ProxyExecutable) this::log);
    members.put("test", (ProxyExecutable) this::test);
    members.put("assert", (ProxyExecutable) this::assertCondition);
    members.put("global", global.toGuest());
    return ProxyObject.fromMap(members);
  }

  private Object log(Value... args) {
    console.log(Arrays.stream(args)
        .map(arg -> arg.isString() ? arg.asString() : arg.toString())
        .collect(Collectors.joining(" ")));
    return null;
  }

  private Object test(Value... args) {
    if (args.length < 2 || !args[0].isString() || !args[1].canExecute()) {
      throw new IllegalArgumentException("client.test expects a test name and a function");
    }
    String name = args[0].asString();
    try {
      args[1].executeVoid();
      tests.accept(name, TestResult.success());
    } catch (PolyglotException ex) {
      if (ex.isCancelled() || ex.isExit() || ex.isInternalError() || ex.isResourceExhausted()) {
        throw ex;
      }
      tests.accept(name, TestResult.failure(message(ex)));
    }
    return null;
  }

  private Object assertCondition(Value... args) {
    if (args.length == 0 || !args[0].isBoolean()) {
      throw new IllegalArgumentException("client.assert expects a boolean condition");
    }
    if (!args[0].asBoolean()) {
      boolean hasMessage = args.length > 1 && !args[1].isNull();
      String message = hasMessage
          ? "Assertion failed: " + (args[1].isString() ? args[1].asString() : args[1].toString())
          : "Assertion failed";
      throw new ScriptAssertionException(message);
    }
    return null;
  }

  static String message(PolyglotException ex) {
    if (ex.isHostException() && ex.asHostException().getMessage() != null) {
      return ex.asHostException().getMessage();
    }
    return ex.getMessage() == null ? ex.toString() : ex.getMessage();
  }

  /**
   * Thrown into the guest by a failing {@code client.assert}.
   */
  static final class ScriptAssertionException extends RuntimeException {

    ScriptAssertionException(String message) {
      super(message);
    }
  }
}
