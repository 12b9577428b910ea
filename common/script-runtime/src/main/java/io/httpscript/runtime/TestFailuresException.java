package io.httpscript.runtime;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Every request ran, but some tests failed.
 */
public class TestFailuresException extends RuntimeException {

  private final List<FailedTest> failures;

  public TestFailuresException(List<FailedTest> failures) {
    super(describe(failures));
    this.failures = List.copyOf(failures);
  }

  public List<FailedTest> failures() {
    return failures;
  }

  private static String describe(List<FailedTest> failures) {
    return failures.size() + " test(s) failed:\n" + failures.stream()
        .map(FailedTest::toString)
        .collect(Collectors.joining("\n"));
  }

  public record FailedTest(String request, String test, String error) {

    public FailedTest {
      Objects.requireNonNull(request, "request");
      Objects.requireNonNull(test, "test");
      Objects.requireNonNull(error, "error");
    }

    @Override
    public String toString() {
      return "Test `" + test + "` in `" + request + "` FAILED with " + error;
    }
  }
}
