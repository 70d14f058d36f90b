package com.investidor.backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

public class ScriptProviderSession implements ProviderSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptProviderSession.class);
    private static final int MAX_LOGGED_OUTPUT = 500;

    private final ObjectMapper objectMapper;
    private final List<String> command;
    private final Path sessionDirectory;
    private final int maxConsecutiveFailures;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile boolean closed;

    public ScriptProviderSession(
            ObjectMapper objectMapper, List<String> command, Path sessionDirectory, int maxConsecutiveFailures) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Extractor command must not be empty");
        }
        this.objectMapper = objectMapper;
        this.command = List.copyOf(command);
        this.sessionDirectory = sessionDirectory;
        this.maxConsecutiveFailures = Math.max(maxConsecutiveFailures, 1);
    }

    @Override
    public RawFieldSet fetchRawFields(
            ProviderId providerId, String ticker, InstrumentType type, Duration timeout) {
        if (closed) {
            throw new ProviderException("Provider session " + sessionDirectory + " is closed");
        }
        try {
            RawFieldSet fields = runExtractor(providerId, ticker, type, timeout);
            consecutiveFailures.set(0);
            return fields;
        } catch (RuntimeException ex) {
            consecutiveFailures.incrementAndGet();
            throw ex;
        }
    }

    @Override
    public boolean isHealthy() {
        return !closed
                && Files.isDirectory(sessionDirectory)
                && consecutiveFailures.get() < maxConsecutiveFailures;
    }

    @Override
    public void close() {
        closed = true;
        try {
            FileSystemUtils.deleteRecursively(sessionDirectory);
        } catch (IOException ex) {
            LOGGER.warn("Unable to delete provider session directory {}", sessionDirectory, ex);
        }
    }

    Path getSessionDirectory() {
        return sessionDirectory;
    }

    private RawFieldSet runExtractor(
            ProviderId providerId, String ticker, InstrumentType type, Duration timeout) {
        List<String> arguments = new ArrayList<>(command);
        arguments.add(providerId.value());
        arguments.add(ticker);
        arguments.add(type.getCode());
        arguments.add(sessionDirectory.toString());

        ProcessBuilder processBuilder = new ProcessBuilder(arguments);
        processBuilder.environment().put("INVESTIDOR_SESSION_DIR", sessionDirectory.toString());
        Process process = null;
        try {
            LOGGER.debug("Running extractor for provider {} and ticker {}: {}", providerId, ticker, arguments);
            process = processBuilder.start();
            CompletableFuture<String> stdoutFuture = readStreamAsync(process.getInputStream());
            CompletableFuture<String> stderrFuture = readStreamAsync(process.getErrorStream());
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ProviderException(
                        "Extractor for provider " + providerId + " timed out after " + timeout);
            }

            int exitCode = process.exitValue();
            String output = safeJoin(stdoutFuture, "stdout");
            String stderr = safeJoin(stderrFuture, "stderr");
            if (LOGGER.isDebugEnabled() && !stderr.isBlank()) {
                LOGGER.debug("Extractor stderr for provider {}: {}", providerId, abbreviate(stderr));
            }
            if (exitCode != 0) {
                throw new ProviderException(
                        "Extractor for provider "
                                + providerId
                                + " exited with status "
                                + exitCode
                                + appendIfNotBlank("; stderr: ", abbreviate(stderr)));
            }
            if (output.isBlank()) {
                throw new ProviderException("Extractor for provider " + providerId + " returned no data");
            }
            return new RawFieldSet(providerId, parseFields(providerId, output));
        } catch (IOException ex) {
            throw new ProviderException("Failed to run extractor for provider " + providerId, ex);
        } catch (InterruptedException ex) {
            if (process != null) {
                process.destroyForcibly();
            }
            Thread.currentThread().interrupt();
            throw new ProviderException("Extractor for provider " + providerId + " was interrupted", ex);
        }
    }

    private Map<String, String> parseFields(ProviderId providerId, String output) throws IOException {
        JsonNode root = objectMapper.readTree(output);
        if (root == null || !root.isObject()) {
            throw new ProviderException(
                    "Extractor for provider " + providerId + " did not return a JSON object: " + abbreviate(output));
        }
        Map<String, String> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = root.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            JsonNode value = entry.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) {
                fields.put(entry.getKey(), null);
            } else if (value.isValueNode()) {
                fields.put(entry.getKey(), value.asText());
            } else {
                fields.put(entry.getKey(), value.toString());
            }
        }
        LOGGER.debug("Extractor for provider {} returned {} fields", providerId, fields.size());
        return fields;
    }

    private CompletableFuture<String> readStreamAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return readOutput(stream);
                    } catch (IOException ex) {
                        throw new CompletionException(ex);
                    }
                });
    }

    private String readOutput(InputStream stream) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        }
    }

    private String safeJoin(CompletableFuture<String> future, String streamName) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new ProviderException("Failed to read extractor " + streamName + " stream", cause);
        }
    }

    private String appendIfNotBlank(String prefix, String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return prefix + value;
    }

    private String abbreviate(String value) {
        if (value.length() <= MAX_LOGGED_OUTPUT) {
            return value;
        }
        return value.substring(0, MAX_LOGGED_OUTPUT) + "...";
    }

    @Override
    public String toString() {
        return "ScriptProviderSession{" + sessionDirectory.getFileName() + '}';
    }
}
