package io.httpscript.cli.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.httpscript.runtime.http.HeaderField;
import io.httpscript.runtime.http.HttpResponse;
import io.httpscript.runtime.http.ResolvedRequest;
import io.httpscript.runtime.output.Output;
import io.httpscript.runtime.output.RequestReport;
import io.httpscript.runtime.scripting.TestResult;
import io.httpscript.runtime.scripting.TestsReport;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Human readable output: every request and response rendered through a format string, followed
 * by a summary of failed tests on the error stream.
 */
public final class FormattedOutput implements Output {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private final PrintStream out;
    private final PrintStream err;
    private final List<FormatItem> requestFormat;
    private final List<FormatItem> responseFormat;
    private boolean failed;

    public FormattedOutput(PrintStream out, PrintStream err, List<FormatItem> requestFormat,
                           List<FormatItem> responseFormat) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.requestFormat = List.copyOf(requestFormat);
        this.responseFormat = List.copyOf(responseFormat);
    }

    @Override
    public void request(ResolvedRequest request, String displayName) {
        StringBuilder text = new StringBuilder();
        for (FormatItem item : requestFormat) {
            if (item instanceof FormatItem.Text literal) {
                text.append(literal.text());
                continue;
            }
            text.append(switch ((FormatItem.Directive) item) {
                case FIRST_LINE -> request.requestLine();
                case HEADERS -> headers(request.headers());
                case BODY -> body(request.body());
                case NAME -> "[" + displayName + "]";
                case TESTS -> "";
            });
        }
        write(text);
    }

    @Override
    public void response(HttpResponse response, TestsReport report) {
        failed = failed || report.hasFailures();
        StringBuilder text = new StringBuilder();
        for (FormatItem item : responseFormat) {
            if (item instanceof FormatItem.Text literal) {
                text.append(literal.text());
                continue;
            }
            text.append(switch ((FormatItem.Directive) item) {
                case FIRST_LINE -> response.statusLine();
                case HEADERS -> headers(response.headers());
                case BODY -> body(response.body());
                case TESTS -> tests(report);
                case NAME -> "";
            });
        }
        write(text);
    }

    @Override
    public void tests(List<RequestReport> reports) {
        if (!failed) {
            return;
        }
        err.println("RUN FAILED");
        int index = 1;
        for (RequestReport report : reports) {
            for (Map.Entry<String, TestResult.Failure> failure : report.report().failed().entrySet()) {
                err.println(index++ + ". Test `" + failure.getKey() + "` in `[" + report.displayName()
                    + "]` FAILED with " + failure.getValue().error());
            }
        }
        err.flush();
    }

    @Override
    public int exitCode() {
        return failed ? 1 : 0;
    }

    private void write(StringBuilder text) {
        if (text.length() > 0) {
            out.print(text);
            out.flush();
        }
    }

    private static String headers(List<HeaderField> headers) {
        StringBuilder text = new StringBuilder();
        for (HeaderField header : headers) {
            text.append(header).append('\n');
        }
        return text.toString();
    }

    /**
     * JSON object bodies are pretty-printed, anything else is written as received.
     */
    static String body(String body) {
        if (body == null) {
            return "";
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            return node != null && node.isObject()
                ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static String tests(TestsReport report) {
        StringBuilder text = new StringBuilder();
        report.results().forEach((name, result) -> {
            text.append("Test `").append(name).append("`: ");
            if (result instanceof TestResult.Failure failure) {
                text.append("FAILED with ").append(failure.error());
            } else {
                text.append("OK");
            }
            text.append('\n');
        });
        return text.toString();
    }
}
