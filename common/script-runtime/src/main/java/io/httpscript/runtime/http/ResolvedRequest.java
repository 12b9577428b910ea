package io.httpscript.runtime.http;

import io.httpscript.parser.Method;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Request with every placeholder substituted, ready for transport.
 *
 * @param target absolute or scheme-relative URL without whitespace
 * @param body   resolved body, {@code null} when the script declares none
 */
public record ResolvedRequest(Method method, String target, List<HeaderField> headers, String body) {

  public ResolvedRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(target, "target");
    headers = headers == null ? List.of() : List.copyOf(headers);
  }

  public Optional<String> optionalBody() {
    return Optional.ofNullable(body);
  }

  /**
   * First line in HTTP message form, e.g. {@code GET http://host/path}.
   */
  public String requestLine() {
    return method + " " + target;
  }
}
