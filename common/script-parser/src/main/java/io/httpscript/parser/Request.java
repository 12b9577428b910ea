package io.httpscript.parser;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Request(Method method, Value target, List<Header> headers, Value body, Selection selection) {

  public Request {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(selection, "selection");
    headers = headers == null ? List.of() : List.copyOf(headers);
  }

  public Optional<Value> optionalBody() {
    return Optional.ofNullable(body);
  }
}
