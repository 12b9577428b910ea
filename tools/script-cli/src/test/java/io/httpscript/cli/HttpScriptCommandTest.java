package io.httpscript.cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HttpScriptCommand end-to-end")
class HttpScriptCommandTest {

    private static final String SCRIPT = """
        ### login
        @user = alice
        POST http://{{host}}/login
        Content-Type: application/json

        {"user": "{{user}}"}

        > {%
            client.global.set("token", response.body.token);
            client.test("logged in", () => client.assert(response.status === 200));
        %}

        ### profile
        GET http://{{host}}/profile
        Authorization: Bearer {{token}}

        > {%
            client.test("profile", () => client.assert(response.body.name === "alice", "wrong profile"));
        %}
        """;

    @TempDir
    Path tempDir;

    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private HttpServer server;
    private volatile String profileName = "alice";
    private Path envFile;
    private Path snapshotFile;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/login", exchange -> {
            requests.add("login " + new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, "{\"token\": \"t-1\"}");
        });
        server.createContext("/profile", exchange -> {
            requests.add("profile " + exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, "{\"name\": \"" + profileName + "\"}");
        });
        server.start();

        envFile = tempDir.resolve("http-client.env.json");
        Files.writeString(envFile, "{\"dev\": {\"host\": \"127.0.0.1:" + server.getAddress().getPort() + "\"}}");
        snapshotFile = tempDir.resolve(".snapshot.json");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should run every request and persist global values")
    void shouldRunScript() throws Exception {
        Path script = Files.writeString(tempDir.resolve("users.http"), SCRIPT);

        int exitCode = run("--request-format", "%N %R\\n", "--response-format", "%R\\n%T", script.toString());

        assertThat(exitCode).isZero();
        assertThat(requests).containsExactly("login {\"user\": \"alice\"}", "profile Bearer t-1");
        assertThat(text(stdout))
            .contains("[" + script + " / login] POST http://127.0.0.1:")
            .contains("HTTP/1.1 200 OK")
            .contains("Test `logged in`: OK")
            .contains("Test `profile`: OK");
        assertThat(Files.readString(snapshotFile)).contains("\"token\" : \"t-1\"");
    }

    @Test
    @DisplayName("Should exit with 1 and list failed tests")
    void shouldReportFailedTests() throws Exception {
        profileName = "bob";
        Path script = Files.writeString(tempDir.resolve("users.http"), SCRIPT);

        int exitCode = run("--request-format", "", "--response-format", "", script.toString());

        assertThat(exitCode).isEqualTo(HttpScriptCommand.EXIT_TESTS_FAILED);
        assertThat(text(stderr))
            .startsWith("RUN FAILED")
            .contains("1. Test `profile` in `[" + script + " / profile]` FAILED with Assertion failed: wrong profile");
        assertThat(Files.readString(snapshotFile)).contains("t-1");
    }

    @Test
    @DisplayName("Should run a single selected request with the persisted snapshot")
    void shouldRunSelectedRequest() throws Exception {
        Files.writeString(snapshotFile, "{\"token\": \"saved\"}");
        Path script = Files.writeString(tempDir.resolve("users.http"), SCRIPT);

        int exitCode = run("--format", "ci", script + "#2");

        assertThat(exitCode).isZero();
        assertThat(requests).containsExactly("profile Bearer saved");
        assertThat(text(stdout))
            .contains("| profile |")
            .contains("1 requests completed, 0 have failed tests");
    }

    @Test
    @DisplayName("Should exit with 2 on parse errors")
    void shouldRejectInvalidScript() throws Exception {
        Path script = Files.writeString(tempDir.resolve("bad.http"), "FETCH http://localhost/\n");

        int exitCode = run(script.toString());

        assertThat(exitCode).isEqualTo(HttpScriptCommand.EXIT_USAGE);
        assertThat(text(stderr)).contains("bad.http:1:1").contains("Unsupported HTTP method 'FETCH'");
        assertThat(requests).isEmpty();
    }

    @Test
    @DisplayName("Should exit with 2 on an invalid format string")
    void shouldRejectInvalidFormat() throws Exception {
        Path script = Files.writeString(tempDir.resolve("users.http"), SCRIPT);

        int exitCode = run("--response-format", "%Q", script.toString());

        assertThat(exitCode).isEqualTo(HttpScriptCommand.EXIT_USAGE);
        assertThat(text(stderr)).contains("Invalid formatting character 'Q'");
    }

    @Test
    @DisplayName("Should exit with 2 when the selected request does not exist")
    void shouldRejectMissingRequest() throws Exception {
        Path script = Files.writeString(tempDir.resolve("users.http"), SCRIPT);

        int exitCode = run(script + "#5");

        assertThat(exitCode).isEqualTo(HttpScriptCommand.EXIT_USAGE);
        assertThat(text(stderr)).contains("Request #5 not found");
    }

    @Test
    @DisplayName("Should exit with 3 and keep the snapshot when a request cannot be sent")
    void shouldStopOnTransportFailure() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        Path script = Files.writeString(tempDir.resolve("down.http"), """
            < {% client.global.set("attempted", true); %}
            GET http://127.0.0.1:PORT/
            """.replace("PORT", String.valueOf(closedPort)));

        int exitCode = run("--connect-timeout", "2", script.toString());

        assertThat(exitCode).isEqualTo(HttpScriptCommand.EXIT_ERROR);
        assertThat(text(stderr)).contains("✗ Execution failed").contains("down.http / #1");
        assertThat(snapshotFile).doesNotExist();
    }

    private int run(String... args) {
        HttpScriptCommand command = new HttpScriptCommand(
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
        String[] all = new String[args.length + 4];
        all[0] = "-n";
        all[1] = envFile.toString();
        all[2] = "-p";
        all[3] = snapshotFile.toString();
        System.arraycopy(args, 0, all, 4, args.length);
        return HttpScriptCommand.commandLine(command).execute(all);
    }

    private static void respond(HttpExchange exchange, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String text(ByteArrayOutputStream stream) {
        return stream.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }
}
