package com.pie.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the workflow scheduler.
 * <p>
 * Concurrency: PIE_MAX_WORKERS (worker slots, default 4). Engine: PIE_CLI_COMMAND, PIE_ENGINE_LOG_LEVEL,
 * PIE_NODE_TIMEOUT_SECONDS (0 = no bound). Payload: PIE_PAYLOAD_MODE (LINEAGE or CONTENT).
 * Loading: PIE_VALIDATE_DEPENDENCIES (reject dangling dependency ids at load instead of reporting deadlock).
 */
public final class SchedulerConfig {

    static final String ENV_MAX_WORKERS = "PIE_MAX_WORKERS";
    static final String ENV_NODE_TIMEOUT_SECONDS = "PIE_NODE_TIMEOUT_SECONDS";
    static final String ENV_CLI_COMMAND = "PIE_CLI_COMMAND";
    static final String ENV_ENGINE_LOG_LEVEL = "PIE_ENGINE_LOG_LEVEL";
    static final String ENV_PAYLOAD_MODE = "PIE_PAYLOAD_MODE";
    static final String ENV_VALIDATE_DEPENDENCIES = "PIE_VALIDATE_DEPENDENCIES";
    static final String ENV_SHUTDOWN_GRACE_SECONDS = "PIE_SHUTDOWN_GRACE_SECONDS";
    static final String ENV_RUN_ID_PREFIX = "PIE_RUN_ID_PREFIX";

    private static final int DEFAULT_MAX_WORKERS = 4;
    private static final int DEFAULT_NODE_TIMEOUT_SECONDS = 0;
    private static final String DEFAULT_CLI_COMMAND = "pie-cli";
    private static final String DEFAULT_ENGINE_LOG_LEVEL = "error";
    private static final String DEFAULT_PAYLOAD_MODE = "LINEAGE";
    private static final boolean DEFAULT_VALIDATE_DEPENDENCIES = false;
    private static final int DEFAULT_SHUTDOWN_GRACE_SECONDS = 30;
    private static final String DEFAULT_RUN_ID_PREFIX = "run_";

    private final int maxWorkers;
    private final int nodeTimeoutSeconds;
    private final String cliCommand;
    private final String engineLogLevel;
    private final String payloadMode;
    private final boolean validateDependencies;
    private final int shutdownGraceSeconds;
    private final String runIdPrefix;

    private SchedulerConfig(Builder b) {
        this.maxWorkers = b.maxWorkers >= 1 ? b.maxWorkers : DEFAULT_MAX_WORKERS;
        this.nodeTimeoutSeconds = Math.max(0, b.nodeTimeoutSeconds);
        this.cliCommand = b.cliCommand;
        this.engineLogLevel = b.engineLogLevel;
        this.payloadMode = b.payloadMode;
        this.validateDependencies = b.validateDependencies;
        this.shutdownGraceSeconds = Math.max(0, b.shutdownGraceSeconds);
        this.runIdPrefix = b.runIdPrefix;
    }

    /** Worker slots: upper bound on nodes dispatched at the same time. Never below 1. */
    public int getMaxWorkers() {
        return maxWorkers;
    }

    /** Per-node engine timeout in seconds; 0 means unbounded. */
    public int getNodeTimeoutSeconds() {
        return nodeTimeoutSeconds;
    }

    /** Per-node engine timeout; {@link Duration#ZERO} means unbounded. */
    public Duration getNodeTimeout() {
        return Duration.ofSeconds(nodeTimeoutSeconds);
    }

    /** Engine CLI executable (PIE_CLI_COMMAND). Default {@code pie-cli}. */
    public String getCliCommand() {
        return cliCommand;
    }

    /** {@code RUST_LOG} level handed to the engine CLI. Default {@code error}. */
    public String getEngineLogLevel() {
        return engineLogLevel;
    }

    /** Payload shape sent to the engine: {@code LINEAGE} (task ids) or {@code CONTENT} (upstream outputs). */
    public String getPayloadMode() {
        return payloadMode;
    }

    /** Whether dangling dependency ids are rejected when the workflow is loaded. Default false. */
    public boolean isValidateDependencies() {
        return validateDependencies;
    }

    /** Seconds to wait for cancelled in-flight workers when a run aborts. Default 30. */
    public int getShutdownGraceSeconds() {
        return shutdownGraceSeconds;
    }

    /** Prefix of generated run ids. Default {@code run_}. */
    public String getRunIdPrefix() {
        return runIdPrefix;
    }

    public static SchedulerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds the configuration from the given variables (normally {@link System#getenv()}).
     * Unparseable numbers fall back to their defaults.
     */
    public static SchedulerConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .maxWorkers(parseInt(env.get(ENV_MAX_WORKERS), DEFAULT_MAX_WORKERS))
                .nodeTimeoutSeconds(parseInt(env.get(ENV_NODE_TIMEOUT_SECONDS), DEFAULT_NODE_TIMEOUT_SECONDS))
                .cliCommand(getEnv(env, ENV_CLI_COMMAND, DEFAULT_CLI_COMMAND))
                .engineLogLevel(getEnv(env, ENV_ENGINE_LOG_LEVEL, DEFAULT_ENGINE_LOG_LEVEL))
                .payloadMode(getEnv(env, ENV_PAYLOAD_MODE, DEFAULT_PAYLOAD_MODE))
                .validateDependencies(parseBoolean(env.get(ENV_VALIDATE_DEPENDENCIES), DEFAULT_VALIDATE_DEPENDENCIES))
                .shutdownGraceSeconds(parseInt(env.get(ENV_SHUTDOWN_GRACE_SECONDS), DEFAULT_SHUTDOWN_GRACE_SECONDS))
                .runIdPrefix(getEnv(env, ENV_RUN_ID_PREFIX, DEFAULT_RUN_ID_PREFIX))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{maxWorkers=" + maxWorkers
                + ", nodeTimeoutSeconds=" + nodeTimeoutSeconds
                + ", cliCommand='" + cliCommand + '\''
                + ", engineLogLevel='" + engineLogLevel + '\''
                + ", payloadMode='" + payloadMode + '\''
                + ", validateDependencies=" + validateDependencies
                + ", shutdownGraceSeconds=" + shutdownGraceSeconds
                + ", runIdPrefix='" + runIdPrefix + "'}";
    }

    public static final class Builder {
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int nodeTimeoutSeconds = DEFAULT_NODE_TIMEOUT_SECONDS;
        private String cliCommand = DEFAULT_CLI_COMMAND;
        private String engineLogLevel = DEFAULT_ENGINE_LOG_LEVEL;
        private String payloadMode = DEFAULT_PAYLOAD_MODE;
        private boolean validateDependencies = DEFAULT_VALIDATE_DEPENDENCIES;
        private int shutdownGraceSeconds = DEFAULT_SHUTDOWN_GRACE_SECONDS;
        private String runIdPrefix = DEFAULT_RUN_ID_PREFIX;

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder nodeTimeoutSeconds(int nodeTimeoutSeconds) {
            this.nodeTimeoutSeconds = nodeTimeoutSeconds;
            return this;
        }

        public Builder cliCommand(String cliCommand) {
            this.cliCommand = cliCommand != null ? cliCommand : DEFAULT_CLI_COMMAND;
            return this;
        }

        public Builder engineLogLevel(String engineLogLevel) {
            this.engineLogLevel = engineLogLevel != null ? engineLogLevel : DEFAULT_ENGINE_LOG_LEVEL;
            return this;
        }

        public Builder payloadMode(String payloadMode) {
            this.payloadMode = payloadMode != null ? payloadMode.trim().toUpperCase() : DEFAULT_PAYLOAD_MODE;
            return this;
        }

        public Builder validateDependencies(boolean validateDependencies) {
            this.validateDependencies = validateDependencies;
            return this;
        }

        public Builder shutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = shutdownGraceSeconds;
            return this;
        }

        public Builder runIdPrefix(String runIdPrefix) {
            this.runIdPrefix = runIdPrefix != null ? runIdPrefix : DEFAULT_RUN_ID_PREFIX;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
