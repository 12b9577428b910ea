package io.httpscript.runtime.http;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Response as seen by response handlers and outputs.
 *
 * @param body response body text, {@code null} when the response carried none
 */
public record HttpResponse(
    HttpVersion version,
    int statusCode,
    String statusText,
    List<HeaderField> headers,
    String body
) {

  public HttpResponse {
    Objects.requireNonNull(version, "version");
    statusText = statusText == null ? "" : statusText;
    headers = headers == null ? List.of() : List.copyOf(headers);
  }

  public Optional<String> optionalBody() {
    return Optional.ofNullable(body);
  }

  /**
   * Status line, e.g. {@code HTTP/1.1 200 OK}.
   */
  public String statusLine() {
    return statusText.isEmpty() ? version + " " + statusCode : version + " " + statusCode + " " + statusText;
  }
}
