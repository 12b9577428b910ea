package io.httpscript.cli.output;

import io.httpscript.runtime.http.HttpResponse;
import io.httpscript.runtime.http.ResolvedRequest;
import io.httpscript.runtime.output.Output;
import io.httpscript.runtime.output.RequestReport;
import io.httpscript.runtime.scripting.TestsReport;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output for CI logs: nothing per request, one table of test results at the end.
 */
public final class CiOutput implements Output {

    private static final String[] HEADER = {"File", "Request", "Test", "Result"};
    private static final int RESULT_COLUMN = 3;

    private final PrintStream out;
    private boolean failed;

    public CiOutput(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void request(ResolvedRequest request, String displayName) {
    }

    @Override
    public void response(HttpResponse response, TestsReport report) {
    }

    @Override
    public void tests(List<RequestReport> reports) {
        List<String[]> rows = new ArrayList<>();
        int failedRequests = 0;
        for (RequestReport report : reports) {
            if (report.report().isEmpty()) {
                rows.add(new String[] {report.sourceName(), report.requestName(), "NO TESTS FOUND", ""});
                continue;
            }
            report.report().results().forEach((test, result) -> rows.add(new String[] {
                report.sourceName(), report.requestName(), test, result.isSuccess() ? "PASSED" : "FAILED"}));
            if (report.report().hasFailures()) {
                failedRequests++;
            }
        }
        failed = failedRequests > 0;

        printTable(rows);
        out.println(reports.size() + " requests completed, " + failedRequests + " have failed tests");
        out.flush();
    }

    @Override
    public int exitCode() {
        return failed ? 1 : 0;
    }

    private void printTable(List<String[]> rows) {
        int[] widths = new int[HEADER.length];
        for (int i = 0; i < HEADER.length; i++) {
            widths[i] = HEADER[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        String border = border(widths);
        out.println(border);
        out.println(row(HEADER, widths));
        out.println(border);
        for (String[] row : rows) {
            out.println(row(row, widths));
        }
        out.println(border);
    }

    private static String border(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.toString();
    }

    private static String row(String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder("|");
        for (int i = 0; i < cells.length; i++) {
            String cell = cells[i];
            int padding = widths[i] - cell.length();
            int left = i == RESULT_COLUMN ? padding / 2 : 0;
            line.append(' ')
                .append(" ".repeat(left))
                .append(cell)
                .append(" ".repeat(padding - left))
                .append(" |");
        }
        return line.toString();
    }
}
