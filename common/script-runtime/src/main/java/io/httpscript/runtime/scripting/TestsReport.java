package io.httpscript.runtime.scripting;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Test results of a single request, ordered by test name.
 */
public final class TestsReport {

  private static final TestsReport EMPTY = new TestsReport(Map.of());

  private final SortedMap<String, TestResult> results;

  private TestsReport(Map<String, TestResult> results) {
    this.results = Collections.unmodifiableSortedMap(new TreeMap<>(results));
  }

  public static TestsReport of(Map<String, TestResult> results) {
    return results.isEmpty() ? EMPTY : new TestsReport(results);
  }

  public static TestsReport empty() {
    return EMPTY;
  }

  public SortedMap<String, TestResult> results() {
    return results;
  }

  public SortedMap<String, TestResult.Failure> failed() {
    SortedMap<String, TestResult.Failure> failed = new TreeMap<>();
    results.forEach((name, result) -> {
      if (result instanceof TestResult.Failure failure) {
        failed.put(name, failure);
      }
    });
    return Collections.unmodifiableSortedMap(failed);
  }

  public boolean hasFailures() {
    return results.values().stream().anyMatch(result -> !result.isSuccess());
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof TestsReport report && results.equals(report.results);
  }

  @Override
  public int hashCode() {
    return results.hashCode();
  }

  @Override
  public String toString() {
    return "TestsReport" + results;
  }
}
