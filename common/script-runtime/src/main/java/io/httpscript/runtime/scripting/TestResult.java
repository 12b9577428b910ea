package io.httpscript.runtime.scripting;

import java.util.Objects;

/**
 * Outcome of one {@code client.test} registration.
 */
public sealed interface TestResult permits TestResult.Success, TestResult.Failure {

  static TestResult success() {
    return Success.INSTANCE;
  }

  static TestResult failure(String error) {
    return new Failure(error);
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  record Success() implements TestResult {
    private static final Success INSTANCE = new Success();
  }

  record Failure(String error) implements TestResult {

    public Failure {
      Objects.requireNonNull(error, "error");
    }
  }
}
