// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.devnode.core.error.ScenarioException;

/**
 * Appends every request a provider receives to a line-delimited JSON file, so a session
 * can be replayed later.
 *
 * <p>The first line holds the provider configuration; each following line is one request
 * exactly as parsed.
 */
final class ScenarioRecorder implements AutoCloseable {

    static final String PREFIX_ENV = "DEVNODE_SCENARIO_PREFIX";

    private static final Logger log = LoggerFactory.getLogger(ScenarioRecorder.class);

    private final ObjectMapper mapper;
    private final Path path;
    private final BufferedWriter writer;

    private ScenarioRecorder(final ObjectMapper mapper, final Path path, final BufferedWriter writer) {
        this.mapper = mapper;
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens a recorder if {@value #PREFIX_ENV} is set in {@code environment}.
     *
     * @throws ScenarioException if the file cannot be created or the header written
     */
    static Optional<ScenarioRecorder> fromEnvironment(final Function<String, String> environment,
            final ObjectMapper mapper, final ProviderConfig config, final boolean loggerEnabled) {
        final String prefix = environment.apply(PREFIX_ENV);
        if (prefix == null || prefix.isEmpty()) {
            return Optional.empty();
        }
        final Path path = Path.of(fileName(prefix));
        final BufferedWriter writer;
        try {
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ScenarioException("Failed to create scenario file " + path, e);
        }
        final ScenarioRecorder recorder = new ScenarioRecorder(mapper, path, writer);
        final ObjectNode header = mapper.createObjectNode();
        header.set("config", mapper.valueToTree(config));
        header.put("loggerEnabled", loggerEnabled);
        recorder.record(header);
        log.info("Recording scenario to {}", path);
        return Optional.of(recorder);
    }

    static String fileName(final String prefix) {
        final long epochSeconds = Instant.now().getEpochSecond();
        final String random = Integer.toUnsignedString(ThreadLocalRandom.current().nextInt());
        return prefix + "_" + epochSeconds + "_" + random + ".json";
    }

    Path path() {
        return path;
    }

    /**
     * @throws ScenarioException if the line cannot be written
     */
    synchronized void record(final JsonNode line) {
        try {
            writer.write(mapper.writeValueAsString(line));
            writer.newLine();
            writer.flush();
        } catch (JsonProcessingException e) {
            throw new ScenarioException("Failed to serialize scenario line", e);
        } catch (IOException e) {
            throw new ScenarioException("Failed to write to scenario file " + path, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close scenario file {}", path, e);
        }
    }
}
