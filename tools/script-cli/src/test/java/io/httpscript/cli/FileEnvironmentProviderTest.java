package io.httpscript.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileEnvironmentProvider")
class FileEnvironmentProviderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should select the named environment")
    void shouldSelectEnvironment() throws Exception {
        Path env = Files.writeString(tempDir.resolve("http-client.env.json"), """
            {
              "dev": {"host": "localhost:8080", "retries": 3},
              "prod": {"host": "api.example.com"}
            }
            """);

        FileEnvironmentProvider provider = new FileEnvironmentProvider("dev", env, tempDir.resolve(".snapshot.json"));

        assertThat(provider.environment()).containsEntry("host", "localhost:8080").containsEntry("retries", 3);
        assertThat(provider.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should start empty when files or the environment are missing")
    void shouldStartEmpty() {
        FileEnvironmentProvider provider = new FileEnvironmentProvider("dev",
            tempDir.resolve("missing.env.json"), tempDir.resolve("missing.snapshot.json"));

        assertThat(provider.environment()).isEmpty();
        assertThat(provider.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should keep the environment out of the saved snapshot")
    void shouldSaveOnlyPersistedValues() throws Exception {
        Path env = Files.writeString(tempDir.resolve("env.json"), "{\"dev\": {\"host\": \"h\"}}");
        Path snapshot = Files.writeString(tempDir.resolve("snapshot.json"), "{\"token\": \"old\"}");

        FileEnvironmentProvider provider = new FileEnvironmentProvider("dev", env, snapshot);
        assertThat(provider.snapshot()).containsExactly(Map.entry("token", "old"));

        provider.save(Map.of("token", "new", "ids", List.of(1, 2)));

        FileEnvironmentProvider reloaded = new FileEnvironmentProvider("dev", env, snapshot);
        assertThat(reloaded.snapshot()).containsEntry("token", "new").containsEntry("ids", List.of(1, 2));
        assertThat(reloaded.snapshot()).doesNotContainKey("host");
    }

    @Test
    @DisplayName("Should create missing snapshot directories")
    void shouldCreateSnapshotDirectories() {
        Path snapshot = tempDir.resolve("state/nested/.snapshot.json");
        FileEnvironmentProvider provider = new FileEnvironmentProvider("dev", tempDir.resolve("env.json"), snapshot);

        provider.save(Map.of("a", "b"));

        assertThat(snapshot).exists();
    }

    @Test
    @DisplayName("Should reject files that are not JSON objects")
    void shouldRejectNonObjects() throws Exception {
        Path env = Files.writeString(tempDir.resolve("env.json"), "[1, 2]");

        assertThatThrownBy(() -> new FileEnvironmentProvider("dev", env, tempDir.resolve("s.json")))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    @DisplayName("Should reject an environment that is not an object")
    void shouldRejectNonObjectEnvironment() throws Exception {
        Path env = Files.writeString(tempDir.resolve("env.json"), "{\"dev\": \"localhost\"}");

        assertThatThrownBy(() -> new FileEnvironmentProvider("dev", env, tempDir.resolve("s.json")))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("'dev'");
    }

    @Test
    @DisplayName("Should report malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
        Path snapshot = Files.writeString(tempDir.resolve("s.json"), "{\"token\": ");

        assertThatThrownBy(() -> new FileEnvironmentProvider("dev", tempDir.resolve("env.json"), snapshot))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("Invalid JSON");
    }
}
