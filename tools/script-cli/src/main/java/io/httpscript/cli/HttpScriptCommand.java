package io.httpscript.cli;

import ch.qos.logback.classic.Level;
import io.httpscript.cli.output.CiOutput;
import io.httpscript.cli.output.FormatItem;
import io.httpscript.cli.output.FormattedOutput;
import io.httpscript.parser.HttpScriptParser;
import io.httpscript.parser.ScriptParseException;
import io.httpscript.runtime.RequestExecutionException;
import io.httpscript.runtime.ScriptRuntime;
import io.httpscript.runtime.TestFailuresException;
import io.httpscript.runtime.output.Output;
import io.httpscript.runtime.scripting.GraalScriptEngine;
import io.httpscript.runtime.source.FilesSourceProvider;
import io.httpscript.runtime.source.SourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * HTTP Script Runner
 *
 * Executes the requests of one or more {@code .http} files in order, runs their handler scripts
 * and reports test results. Values stored with {@code client.global} are kept in a snapshot file
 * between invocations.
 */
@Command(
    name = "httpscript",
    version = "1.0.0",
    description = "Execute .http request scripts and report their tests",
    mixinStandardHelpOptions = true,
    headerHeading = "%n@|bold,underline HTTP Script Runner|@%n%n",
    descriptionHeading = "%n@|bold Description:|@%n",
    parameterListHeading = "%n@|bold Parameters:|@%n",
    optionListHeading = "%n@|bold Options:|@%n",
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  Every request of a file:",
        "    httpscript requests/users.http",
        "",
        "  Only the second request, against the staging environment:",
        "    httpscript -e staging requests/users.http#2",
        "",
        "  Test table for CI logs:",
        "    httpscript --format ci requests/*.http",
        "",
        "  Only status lines:",
        "    httpscript --request-format \"\" --response-format \"%R\\n\" requests/users.http",
        ""
    }
)
public class HttpScriptCommand implements Callable<Integer> {

    static final int EXIT_TESTS_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ERROR = 3;

    private static final Logger log = LoggerFactory.getLogger(HttpScriptCommand.class);

    enum Format {
        STANDARD,
        CI
    }

    @Parameters(
        paramLabel = "FILE[#N]",
        arity = "1..*",
        description = "Request files to execute; #N selects the N-th request of a file (1-based)"
    )
    private List<String> files;

    @Option(
        names = {"-n", "--environment-file"},
        description = "JSON file mapping environment names to initial variables (default: ${DEFAULT-VALUE})",
        defaultValue = "http-client.env.json"
    )
    private Path environmentFile;

    @Option(
        names = {"-p", "--snapshot"},
        description = "JSON file persisting client.global values between runs (default: ${DEFAULT-VALUE})",
        defaultValue = ".snapshot.json"
    )
    private Path snapshotFile;

    @Option(
        names = {"-e", "--environment"},
        description = "Environment to select from the environment file (default: ${DEFAULT-VALUE})",
        defaultValue = "dev"
    )
    private String environment;

    @Option(
        names = {"--request-format"},
        description = "Request output format, standard format only: %%R request line, %%N name, "
            + "%%H headers, %%B body (default: %%N\\n%%R\\n\\n)",
        defaultValue = "%N\\n%R\\n\\n"
    )
    private String requestFormat;

    @Option(
        names = {"--response-format"},
        description = "Response output format, standard format only: %%R status line, %%H headers, "
            + "%%B body, %%T tests (default: %%R\\n%%H\\n%%B\\n\\n%%T\\n)",
        defaultValue = "%R\\n%H\\n%B\\n\\n%T\\n"
    )
    private String responseFormat;

    @Option(
        names = {"--format"},
        description = "Output mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "STANDARD"
    )
    private Format format;

    @Option(
        names = {"--accept-invalid-certs"},
        description = "Skip TLS certificate and hostname verification"
    )
    private boolean acceptInvalidCerts;

    @Option(
        names = {"--connect-timeout"},
        description = "Connect timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private long connectTimeoutSeconds;

    @Option(
        names = {"--response-timeout"},
        description = "Response timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private long responseTimeoutSeconds;

    @Option(
        names = {"--no-follow-redirects"},
        description = "Report redirect responses instead of following them"
    )
    private boolean noFollowRedirects;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable debug logging and stack traces"
    )
    private boolean verbose;

    private final PrintStream out;
    private final PrintStream err;

    public HttpScriptCommand() {
        this(System.out, System.err);
    }

    HttpScriptCommand(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    @Override
    public Integer call() {
        try {
            if (verbose) {
                enableDebugLogging();
            }

            Output output = output();
            ClientConfig config = ClientConfig.builder()
                .acceptInvalidCertificates(acceptInvalidCerts)
                .connectTimeout(seconds("--connect-timeout", connectTimeoutSeconds))
                .responseTimeout(seconds("--response-timeout", responseTimeoutSeconds))
                .followRedirects(!noFollowRedirects)
                .build();
            FileEnvironmentProvider environmentProvider =
                new FileEnvironmentProvider(environment, environmentFile, snapshotFile);
            SourceProvider source = FilesSourceProvider.fromList(new HttpScriptParser(), files);

            try (ApacheScriptHttpClient client = ApacheScriptHttpClient.create(config);
                 GraalScriptEngine engine = new GraalScriptEngine(
                     environmentProvider.environment(), environmentProvider.snapshot())) {
                int executed = new ScriptRuntime(engine, client, output, environmentProvider).execute(source);
                log.debug("Executed {} request(s)", executed);
            }
            return output.exitCode();

        } catch (TestFailuresException e) {
            log.debug("Run finished with failed tests", e);
            return EXIT_TESTS_FAILED;
        } catch (ScriptParseException e) {
            err.println("✗ Parse error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (UsageException | IllegalArgumentException e) {
            err.println("✗ Invalid usage: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_USAGE;
        } catch (RequestExecutionException e) {
            err.println("✗ Execution failed: " + e.getMessage());
            if (verbose) {
                err.println("\nDetails:");
                e.printStackTrace(err);
            } else {
                err.println("(Use -v for detailed error information)");
            }
            return EXIT_ERROR;
        } catch (Exception e) {
            err.println("✗ Unexpected error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_ERROR;
        }
    }

    private Output output() {
        if (format == Format.CI) {
            return new CiOutput(out);
        }
        return new FormattedOutput(
            out,
            err,
            FormatItem.parse(FormatItem.unescape(requestFormat)),
            FormatItem.parse(FormatItem.unescape(responseFormat)));
    }

    private static Duration seconds(String option, long value) {
        if (value < 1) {
            throw new UsageException(option + " must be positive (got: " + value + ")");
        }
        return Duration.ofSeconds(value);
    }

    private static void enableDebugLogging() {
        Logger logger = LoggerFactory.getLogger("io.httpscript");
        if (logger instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }

    static CommandLine commandLine(HttpScriptCommand command) {
        return new CommandLine(command)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO));
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new HttpScriptCommand()).execute(args);
        System.exit(exitCode);
    }
}
