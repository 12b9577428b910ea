package io.httpscript.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.httpscript.runtime.environment.EnvironmentProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Environment and snapshot backed by JSON files.
 *
 * <p>The environment file maps environment names to objects of variables, e.g.
 * {@code {"dev": {"host": "localhost:8080"}}}. The snapshot file is a single object holding the
 * persisted values of the previous run and is rewritten on {@link #save}. Missing files read as
 * empty objects.
 */
public final class FileEnvironmentProvider implements EnvironmentProvider {

    private static final Logger log = LoggerFactory.getLogger(FileEnvironmentProvider.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final Map<String, Object> environment;
    private final Map<String, Object> snapshot;
    private final Path snapshotPath;

    /**
     * @throws UsageException       when a file is not a JSON object or the selected environment
     *                              is not an object
     * @throws UncheckedIOException when a file exists but cannot be read
     */
    public FileEnvironmentProvider(String environmentName, Path environmentPath, Path snapshotPath) {
        Objects.requireNonNull(environmentName, "environmentName");
        Objects.requireNonNull(environmentPath, "environmentPath");
        this.snapshotPath = Objects.requireNonNull(snapshotPath, "snapshotPath");

        JsonNode environments = readObject(environmentPath, "environment file");
        JsonNode selected = environments.get(environmentName);
        if (selected == null) {
            log.debug("Environment '{}' not found in {}, starting empty", environmentName, environmentPath);
            this.environment = Map.of();
        } else if (!selected.isObject()) {
            throw new UsageException("Environment '" + environmentName + "' in " + environmentPath
                + " must be a JSON object");
        } else {
            this.environment = Collections.unmodifiableMap(mapper.convertValue(selected, MAP));
        }
        this.snapshot = mapper.convertValue(readObject(snapshotPath, "snapshot file"), MAP);
    }

    @Override
    public Map<String, Object> environment() {
        return environment;
    }

    @Override
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(snapshot);
    }

    @Override
    public void save(Map<String, Object> snapshot) {
        try {
            Path parent = snapshotPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(snapshotPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot));
            log.debug("Saved {} persisted value(s) to {}", snapshot.size(), snapshotPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write snapshot " + snapshotPath, e);
        }
    }

    private JsonNode readObject(Path path, String description) {
        JsonNode node;
        try {
            node = mapper.readTree(Files.readString(path));
        } catch (NoSuchFileException e) {
            log.debug("No {} at {}", description, path);
            return mapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new UsageException("Invalid JSON in " + description + " " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + description + " " + path, e);
        }
        if (node == null || node.isMissingNode()) {
            return mapper.createObjectNode();
        }
        if (!node.isObject()) {
            throw new UsageException("Expected " + description + " " + path + " to contain a JSON object");
        }
        return node;
    }
}
