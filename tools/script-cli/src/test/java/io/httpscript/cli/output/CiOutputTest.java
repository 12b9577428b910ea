package io.httpscript.cli.output;

import io.httpscript.runtime.output.RequestReport;
import io.httpscript.runtime.scripting.TestResult;
import io.httpscript.runtime.scripting.TestsReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CiOutput table")
class CiOutputTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final CiOutput output = new CiOutput(new PrintStream(stdout, true, StandardCharsets.UTF_8));

    @Test
    @DisplayName("Should print one row per test and a summary line")
    void shouldPrintTable() {
        output.tests(List.of(
            new RequestReport("users.http", "login", TestsReport.of(Map.of(
                "status", TestResult.success(),
                "token", TestResult.failure("Assertion failed")))),
            new RequestReport("users.http", "#2", TestsReport.empty())));

        List<String> lines = stdout.toString(StandardCharsets.UTF_8).lines().toList();

        assertThat(lines).containsExactly(
            "+------------+---------+----------------+--------+",
            "| File       | Request | Test           | Result |",
            "+------------+---------+----------------+--------+",
            "| users.http | login   | status         | PASSED |",
            "| users.http | login   | token          | FAILED |",
            "| users.http | #2      | NO TESTS FOUND |        |",
            "+------------+---------+----------------+--------+",
            "2 requests completed, 1 have failed tests");
        assertThat(output.exitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should succeed when every test passed")
    void shouldSucceedWithoutFailures() {
        output.tests(List.of(new RequestReport("a.http", "#1",
            TestsReport.of(Map.of("ok", TestResult.success())))));

        assertThat(stdout.toString(StandardCharsets.UTF_8))
            .contains("1 requests completed, 0 have failed tests");
        assertThat(output.exitCode()).isZero();
    }
}
