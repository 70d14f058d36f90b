package com.investidor.backend.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class ScriptProviderSessionFactory implements ProviderSessionFactory {

    private final ObjectMapper objectMapper;
    private final List<String> command;
    private final Path baseDirectory;
    private final int maxConsecutiveFailures;

    public ScriptProviderSessionFactory(
            ObjectMapper objectMapper, List<String> command, String baseDirectory, int maxConsecutiveFailures) {
        this.objectMapper = objectMapper;
        this.command = List.copyOf(command);
        this.baseDirectory = resolveBaseDirectory(baseDirectory);
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    @Override
    public ProviderSession create() {
        try {
            Files.createDirectories(baseDirectory);
            Path sessionDirectory = Files.createTempDirectory(baseDirectory, "provider-session-");
            return new ScriptProviderSession(objectMapper, command, sessionDirectory, maxConsecutiveFailures);
        } catch (IOException ex) {
            throw new ProviderException("Unable to create provider session directory under " + baseDirectory, ex);
        }
    }

    private Path resolveBaseDirectory(String configured) {
        if (configured == null || configured.isBlank()) {
            return Paths.get(System.getProperty("java.io.tmpdir"), "investidor-sessions");
        }
        return Paths.get(configured).toAbsolutePath().normalize();
    }
}
