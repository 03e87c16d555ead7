/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Settings shared by the rule set and the data-store adapters.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables (or system
 * properties of the same name) using the pattern {@code VALIDATION_<PROPERTY_NAME>}:
 * <pre>
 * VALIDATION_CONNECTION_GROUP_KEY=DBGroup
 * VALIDATION_DEFAULT_CONNECTION_GROUP=default
 * VALIDATION_QUERY_TIMEOUT_SECONDS=5
 * VALIDATION_PARAMETER_CACHE_SIZE=1000
 * VALIDATION_TRACING_ENABLED=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ValidationConfig config = ValidationConfig.builder()
 *     .defaultConnectionGroup("accounts")
 *     .queryTimeoutSeconds(2)
 *     .build();
 *
 * ValidationConfig fromFile = ValidationConfig.fromJson(Path.of("validation.json"));
 * }</pre>
 */
public final class ValidationConfig {

    private static final Logger logger = Logger.getLogger(ValidationConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_CONNECTION_GROUP_KEY = "VALIDATION_CONNECTION_GROUP_KEY";
    static final String ENV_DEFAULT_CONNECTION_GROUP = "VALIDATION_DEFAULT_CONNECTION_GROUP";
    static final String ENV_QUERY_TIMEOUT_SECONDS = "VALIDATION_QUERY_TIMEOUT_SECONDS";
    static final String ENV_PARAMETER_CACHE_SIZE = "VALIDATION_PARAMETER_CACHE_SIZE";
    static final String ENV_TRACING_ENABLED = "VALIDATION_TRACING_ENABLED";

    public static final String DEFAULT_CONNECTION_GROUP_KEY = "DBGroup";
    public static final String DEFAULT_GROUP_NAME = "default";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String connectionGroupKey;
    private final String defaultConnectionGroup;
    private final int queryTimeoutSeconds;
    private final long parameterCacheSize;
    private final boolean tracingEnabled;

    private ValidationConfig(Builder builder) {
        this.connectionGroupKey = builder.connectionGroupKey;
        this.defaultConnectionGroup = builder.defaultConnectionGroup;
        this.queryTimeoutSeconds = builder.queryTimeoutSeconds;
        this.parameterCacheSize = builder.parameterCacheSize;
        this.tracingEnabled = builder.tracingEnabled;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Small parameter cache, no query timeout pressure, tracing off.
     */
    public static ValidationConfig forDevelopment() {
        return builder()
                .parameterCacheSize(100)
                .queryTimeoutSeconds(30)
                .tracingEnabled(false)
                .build();
    }

    public static ValidationConfig forProduction() {
        return builder()
                .parameterCacheSize(10_000)
                .queryTimeoutSeconds(5)
                .tracingEnabled(true)
                .build();
    }

    /**
     * Defaults plus environment overrides.
     */
    public static ValidationConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Load configuration from a JSON file. Environment variables still win over file values.
     *
     * <pre>
     * {
     *   "connection_group_key": "DBGroup",
     *   "default_connection_group": "accounts",
     *   "query_timeout_seconds": 2,
     *   "parameter_cache_size": 500,
     *   "tracing_enabled": false
     * }
     * </pre>
     *
     * @param path JSON file
     * @return configuration with file values applied
     */
    public static ValidationConfig fromJson(Path path) {
        logger.info("Loading validation configuration from: " + path);
        try {
            ConfigFile file = MAPPER.readValue(Files.readString(path), ConfigFile.class);
            Builder builder = new Builder(false);
            file.applyTo(builder);
            builder.applyEnvironmentVariables();
            return builder.build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read validation configuration: " + path, e);
        }
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    /**
     * @return reserved submission key that carries the data-store group name
     */
    public String connectionGroupKey() {
        return connectionGroupKey;
    }

    public String defaultConnectionGroup() {
        return defaultConnectionGroup;
    }

    public int queryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public long parameterCacheSize() {
        return parameterCacheSize;
    }

    public boolean tracingEnabled() {
        return tracingEnabled;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Builder initialized with this configuration's values; environment is not re-read.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.connectionGroupKey = this.connectionGroupKey;
        builder.defaultConnectionGroup = this.defaultConnectionGroup;
        builder.queryTimeoutSeconds = this.queryTimeoutSeconds;
        builder.parameterCacheSize = this.parameterCacheSize;
        builder.tracingEnabled = this.tracingEnabled;
        return builder;
    }

    public static class Builder {

        private String connectionGroupKey = DEFAULT_CONNECTION_GROUP_KEY;
        private String defaultConnectionGroup = DEFAULT_GROUP_NAME;
        private int queryTimeoutSeconds = 5;
        private long parameterCacheSize = 1_000;
        private boolean tracingEnabled = true;

        private Builder(boolean loadEnvironment) {
            if (loadEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnv(ENV_CONNECTION_GROUP_KEY).ifPresent(val -> this.connectionGroupKey = val);
            getEnv(ENV_DEFAULT_CONNECTION_GROUP).ifPresent(val -> this.defaultConnectionGroup = val);
            getEnvInt(ENV_QUERY_TIMEOUT_SECONDS).ifPresent(val -> this.queryTimeoutSeconds = val);
            getEnvLong(ENV_PARAMETER_CACHE_SIZE).ifPresent(val -> this.parameterCacheSize = val);
            getEnvBoolean(ENV_TRACING_ENABLED).ifPresent(val -> this.tracingEnabled = val);
        }

        public Builder connectionGroupKey(String key) {
            this.connectionGroupKey = key;
            return this;
        }

        public Builder defaultConnectionGroup(String group) {
            this.defaultConnectionGroup = group;
            return this;
        }

        /**
         * @param seconds JDBC query timeout, 0 for none
         */
        public Builder queryTimeoutSeconds(int seconds) {
            this.queryTimeoutSeconds = seconds;
            return this;
        }

        public Builder parameterCacheSize(long size) {
            this.parameterCacheSize = size;
            return this;
        }

        public Builder tracingEnabled(boolean enable) {
            this.tracingEnabled = enable;
            return this;
        }

        public ValidationConfig build() {
            return new ValidationConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded override: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Boolean> getEnvBoolean(String key) {
            return getEnv(key).map(val -> {
                String normalized = val.toLowerCase();
                return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
            });
        }
    }

    private void validate() {
        if (connectionGroupKey == null || connectionGroupKey.isBlank()) {
            throw new IllegalArgumentException("connectionGroupKey must not be blank");
        }
        if (defaultConnectionGroup == null || defaultConnectionGroup.isBlank()) {
            throw new IllegalArgumentException("defaultConnectionGroup must not be blank");
        }
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("queryTimeoutSeconds must not be negative: " + queryTimeoutSeconds);
        }
        if (parameterCacheSize <= 0) {
            throw new IllegalArgumentException("parameterCacheSize must be positive: " + parameterCacheSize);
        }
    }

    @Override
    public String toString() {
        return "ValidationConfig{" +
                "connectionGroupKey='" + connectionGroupKey + '\'' +
                ", defaultConnectionGroup='" + defaultConnectionGroup + '\'' +
                ", queryTimeoutSeconds=" + queryTimeoutSeconds +
                ", parameterCacheSize=" + parameterCacheSize +
                ", tracingEnabled=" + tracingEnabled +
                '}';
    }

    /**
     * JSON file shape; absent properties keep the builder's value.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigFile(
            @JsonProperty("connection_group_key") String connectionGroupKey,
            @JsonProperty("default_connection_group") String defaultConnectionGroup,
            @JsonProperty("query_timeout_seconds") Integer queryTimeoutSeconds,
            @JsonProperty("parameter_cache_size") Long parameterCacheSize,
            @JsonProperty("tracing_enabled") Boolean tracingEnabled
    ) {
        void applyTo(Builder builder) {
            if (connectionGroupKey != null) builder.connectionGroupKey(connectionGroupKey);
            if (defaultConnectionGroup != null) builder.defaultConnectionGroup(defaultConnectionGroup);
            if (queryTimeoutSeconds != null) builder.queryTimeoutSeconds(queryTimeoutSeconds);
            if (parameterCacheSize != null) builder.parameterCacheSize(parameterCacheSize);
            if (tracingEnabled != null) builder.tracingEnabled(tracingEnabled);
        }
    }
}
