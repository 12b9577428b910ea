package io.httpscript.runtime.scripting;

import io.httpscript.parser.Request;
import io.httpscript.runtime.http.HttpResponse;
import java.util.Map;

/**
 * Embedded scripting host used while running one sequence of request scripts.
 *
 * <p>The host keeps three variable stores:
 * <ul>
 *   <li>the persisted store, read and written through {@code client.global} and exported by
 *   {@link #snapshot()};</li>
 *   <li>the read-only environment store, the fallback of {@code client.global.get};</li>
 *   <li>the per-request store, filled by {@link #defineVariable} and {@code request.variables}.</li>
 * </ul>
 * Implementations are not thread-safe; a host is owned by a single runtime.
 */
public interface ScriptEngine extends AutoCloseable {

  /**
   * Evaluates a script against the current global state.
   *
   * @return the JavaScript string form of the completion value
   * @throws ScriptExecutionException when the script fails to parse or throws
   */
  String executeScript(Script script);

  /**
   * Resolves the text of one placeholder. Fragments starting with {@code $} are evaluated as
   * expressions; bare names are looked up in the per-request, persisted and environment stores,
   * in that order. Unknown names resolve to {@code {{name}}}.
   */
  String resolveRequestVariable(String script);

  void defineVariable(String name, String value);

  /**
   * Runs a pre-request handler with {@code request} bound to a view of the unprocessed request.
   */
  void preHandle(Script script, Request request);

  /**
   * Runs a response handler with {@code response} bound to the received response.
   */
  void handle(Script script, HttpResponse response);

  /**
   * Tests registered through {@code client.test} since the last reset.
   */
  TestsReport report();

  /**
   * Discards every piece of script state except the persisted store.
   */
  void reset();

  /**
   * Copy of the persisted store.
   */
  Map<String, Object> snapshot();

  @Override
  void close();
}
