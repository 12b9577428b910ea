package io.httpscript.parser;

import java.util.Optional;

public enum Method {
  GET,
  POST,
  DELETE,
  PUT,
  PATCH,
  OPTIONS;

  public static Optional<Method> fromToken(String token) {
    for (Method method : values()) {
      if (method.name().equals(token)) {
        return Optional.of(method);
      }
    }
    return Optional.empty();
  }
}
