package com.matrixwatcher.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable process configuration for the watcher runtime.
 *
 * <p>
 * Covers what the process needs around the analysis core: where the YAML
 * settings and the learned patterns live, the health port and the intervals
 * of the housekeeping tasks. Analysis tuning lives in
 * {@link com.matrixwatcher.core.config.WatcherSettings}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuntimeConfig {

    // ---------------------------------------------------------------
    // Settings / storage
    // ---------------------------------------------------------------
    private final String watcherConfigPath;
    private final String patternStorageDir;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;
    private final int healthCheckIntervalSeconds;
    private final int taskFailureThreshold;

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------
    private final int persistIntervalSeconds;

    private RuntimeConfig(Builder b) {
        this.watcherConfigPath = b.watcherConfigPath;
        this.patternStorageDir = b.patternStorageDir;
        this.healthPort = b.healthPort;
        this.healthCheckIntervalSeconds = b.healthCheckIntervalSeconds;
        this.taskFailureThreshold = b.taskFailureThreshold;
        this.persistIntervalSeconds = b.persistIntervalSeconds;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RuntimeConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RuntimeConfig fromEnvironment() {
        try {
            return new Builder()
                    .watcherConfigPath(env("WATCHER_CONFIG_PATH", ""))
                    .patternStorageDir(env("PATTERN_STORAGE_DIR", "data/patterns"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .healthCheckIntervalSeconds(parseIntEnv("HEALTH_CHECK_INTERVAL_SECONDS", "60"))
                    .taskFailureThreshold(parseIntEnv("TASK_FAILURE_THRESHOLD", "5"))
                    .persistIntervalSeconds(parseIntEnv("PERSIST_INTERVAL_SECONDS", "300"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return explicit settings file path; blank means automatic resolution
     */
    public String getWatcherConfigPath() {
        return watcherConfigPath;
    }

    public String getPatternStorageDir() {
        return patternStorageDir;
    }

    public Path patternStoragePath() {
        return Path.of(patternStorageDir);
    }

    public int getHealthPort() {
        return healthPort;
    }

    public int getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public Duration healthCheckInterval() {
        return Duration.ofSeconds(healthCheckIntervalSeconds);
    }

    public int getTaskFailureThreshold() {
        return taskFailureThreshold;
    }

    public int getPersistIntervalSeconds() {
        return persistIntervalSeconds;
    }

    public Duration persistInterval() {
        return Duration.ofSeconds(persistIntervalSeconds);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RuntimeConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (port in [1, 65535], intervals and failure threshold &gt; 0,
     * non-blank storage directory).
     * </p>
     */
    public static class Builder {
        private String watcherConfigPath = "";
        private String patternStorageDir = "data/patterns";
        private int healthPort = 8080;
        private int healthCheckIntervalSeconds = 60;
        private int taskFailureThreshold = 5;
        private int persistIntervalSeconds = 300;

        public Builder watcherConfigPath(String v) {
            this.watcherConfigPath = v;
            return this;
        }

        public Builder patternStorageDir(String v) {
            this.patternStorageDir = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder healthCheckIntervalSeconds(int v) {
            this.healthCheckIntervalSeconds = v;
            return this;
        }

        public Builder taskFailureThreshold(int v) {
            this.taskFailureThreshold = v;
            return this;
        }

        public Builder persistIntervalSeconds(int v) {
            this.persistIntervalSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RuntimeConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RuntimeConfig build() {
            Objects.requireNonNull(watcherConfigPath, "watcherConfigPath required");
            requireNonBlank(patternStorageDir, "patternStorageDir");

            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (healthCheckIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "healthCheckIntervalSeconds must be >= 1, got: " + healthCheckIntervalSeconds);
            }
            if (taskFailureThreshold < 1) {
                throw new IllegalArgumentException(
                        "taskFailureThreshold must be >= 1, got: " + taskFailureThreshold);
            }
            if (persistIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "persistIntervalSeconds must be >= 1, got: " + persistIntervalSeconds);
            }

            return new RuntimeConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "RuntimeConfig{" +
                "watcherConfigPath='" + watcherConfigPath + '\'' +
                ", patternStorageDir='" + patternStorageDir + '\'' +
                ", healthPort=" + healthPort +
                ", healthCheckIntervalSeconds=" + healthCheckIntervalSeconds +
                ", taskFailureThreshold=" + taskFailureThreshold +
                ", persistIntervalSeconds=" + persistIntervalSeconds +
                '}';
    }
}
