package com.investidor.backend.provider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "investidor.providers")
public class ProviderProperties {

    /**
     * Timeout applied to a provider that does not declare its own.
     */
    private Duration timeout = Duration.ofSeconds(45);

    /**
     * Extractor command; the provider id, ticker, instrument type and session directory are
     * appended as arguments.
     */
    private List<String> command = new ArrayList<>(List.of("node", "extractor/extract.js"));

    /**
     * Directory where per-session working directories are created. Defaults to the system
     * temporary directory.
     */
    private String sessionDirectory;

    private int maxSessions = 4;
    private Duration leaseTimeout = Duration.ofSeconds(10);
    private int maxConsecutiveFailures = 3;
    private List<Definition> definitions = new ArrayList<>();

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
            this.timeout = timeout;
        }
    }

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        if (command != null && !command.isEmpty()) {
            this.command = command;
        }
    }

    public String getSessionDirectory() {
        return sessionDirectory;
    }

    public void setSessionDirectory(String sessionDirectory) {
        this.sessionDirectory = sessionDirectory;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        if (maxSessions > 0) {
            this.maxSessions = maxSessions;
        }
    }

    public Duration getLeaseTimeout() {
        return leaseTimeout;
    }

    public void setLeaseTimeout(Duration leaseTimeout) {
        if (leaseTimeout != null && !leaseTimeout.isNegative()) {
            this.leaseTimeout = leaseTimeout;
        }
    }

    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
        if (maxConsecutiveFailures > 0) {
            this.maxConsecutiveFailures = maxConsecutiveFailures;
        }
    }

    public List<Definition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(List<Definition> definitions) {
        this.definitions = definitions == null ? new ArrayList<>() : definitions;
    }

    public static class Definition {

        private String id;
        private boolean primary;

        /**
         * Overrides {@code investidor.providers.timeout} for this provider.
         */
        private Duration timeout;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public boolean isPrimary() {
            return primary;
        }

        public void setPrimary(boolean primary) {
            this.primary = primary;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
