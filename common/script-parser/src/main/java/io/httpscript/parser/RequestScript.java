package io.httpscript.parser;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code ###} delimited section of a script file.
 */
public record RequestScript(
    String name,
    Request request,
    List<VariableDeclaration> requestVariables,
    Handler preRequestHandler,
    Handler handler,
    Selection selection
) {

  public RequestScript {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(selection, "selection");
    requestVariables = requestVariables == null ? List.of() : List.copyOf(requestVariables);
  }

  public Optional<String> optionalName() {
    return Optional.ofNullable(name);
  }

  public Optional<Handler> optionalPreRequestHandler() {
    return Optional.ofNullable(preRequestHandler);
  }

  public Optional<Handler> optionalHandler() {
    return Optional.ofNullable(handler);
  }
}
