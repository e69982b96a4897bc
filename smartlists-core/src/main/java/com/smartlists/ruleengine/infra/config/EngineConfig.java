/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.infra.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Engine configuration.
 *
 * <p>Values are resolved in this order, later sources winning:
 * <ol>
 *   <li>Built-in defaults</li>
 *   <li>Properties file ({@code smartlists.properties} on the classpath, else on disk)</li>
 *   <li>Environment variables</li>
 * </ol>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>SMARTLISTS_BATCH_SIZE: candidates pulled per batch (default 300)</li>
 *   <li>SMARTLISTS_WORKER_THREADS: parallel workers per run (default: available processors)</li>
 *   <li>SMARTLISTS_REGEX_TIMEOUT_MS: per-match regex budget (default 100)</li>
 *   <li>SMARTLISTS_DEFAULT_MAX_ITEMS: list size when a definition sets none (default 500)</li>
 *   <li>SMARTLISTS_DEFAULT_MAX_PLAYTIME_MINUTES: playtime cap when a definition sets none (default 0 = off)</li>
 *   <li>SMARTLISTS_TWO_PHASE_ENABLED: cheap predicates before expensive lookups (default true)</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EngineConfig config = EngineConfig.loadDefault();
 *
 * EngineConfig custom = EngineConfig.builder()
 *     .processingBatchSize(100)
 *     .workerThreads(1)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_PROPERTIES_FILE = "smartlists.properties";

    public static final int DEFAULT_BATCH_SIZE = 300;
    public static final long DEFAULT_REGEX_TIMEOUT_MILLIS = 100;
    public static final int DEFAULT_MAX_ITEMS = 500;
    public static final int DEFAULT_MAX_PLAYTIME_MINUTES = 0;

    private final int processingBatchSize;
    private final int workerThreads;
    private final long regexTimeoutMillis;
    private final int defaultMaxItems;
    private final int defaultMaxPlaytimeMinutes;
    private final boolean twoPhaseFiltering;

    private EngineConfig(Builder builder) {
        this.processingBatchSize = builder.processingBatchSize;
        this.workerThreads = builder.workerThreads;
        this.regexTimeoutMillis = builder.regexTimeoutMillis;
        this.defaultMaxItems = builder.defaultMaxItems;
        this.defaultMaxPlaytimeMinutes = builder.defaultMaxPlaytimeMinutes;
        this.twoPhaseFiltering = builder.twoPhaseFiltering;
    }

    public int getProcessingBatchSize() {
        return processingBatchSize;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public long getRegexTimeoutMillis() {
        return regexTimeoutMillis;
    }

    public int getDefaultMaxItems() {
        return defaultMaxItems;
    }

    public int getDefaultMaxPlaytimeMinutes() {
        return defaultMaxPlaytimeMinutes;
    }

    /**
     * When false every item is evaluated in a single pass; results are identical.
     */
    public boolean isTwoPhaseFiltering() {
        return twoPhaseFiltering;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LOADING
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Loads {@value #DEFAULT_PROPERTIES_FILE} with environment overrides.
     *
     * <p><b>Example smartlists.properties:</b>
     * <pre>
     * smartlists.batch.size=300
     * smartlists.worker.threads=4
     * smartlists.regex.timeout.ms=100
     * smartlists.default.max.items=500
     * smartlists.default.max.playtime.minutes=0
     * smartlists.two.phase.enabled=true
     * </pre>
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Loads configuration from a properties file searched on the classpath first,
     * then on the file system. A missing file leaves the defaults in place.
     * Environment variables override file values.
     */
    public static EngineConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.debug("Could not load from classpath: {}", propertiesPath, e);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.info("No properties file {} found, using defaults", propertiesPath);
            }
        }

        return fromProperties(props, System::getenv);
    }

    /**
     * Builds a configuration from properties and an environment lookup.
     * Visible for tests, which pass a fake environment.
     */
    static EngineConfig fromProperties(Properties props, Function<String, String> env) {
        Builder builder = builder();

        readInt(props.getProperty("smartlists.batch.size"), "smartlists.batch.size")
                .ifPresent(builder::processingBatchSize);
        readInt(props.getProperty("smartlists.worker.threads"), "smartlists.worker.threads")
                .ifPresent(builder::workerThreads);
        readLong(props.getProperty("smartlists.regex.timeout.ms"), "smartlists.regex.timeout.ms")
                .ifPresent(builder::regexTimeoutMillis);
        readInt(props.getProperty("smartlists.default.max.items"), "smartlists.default.max.items")
                .ifPresent(builder::defaultMaxItems);
        readInt(props.getProperty("smartlists.default.max.playtime.minutes"), "smartlists.default.max.playtime.minutes")
                .ifPresent(builder::defaultMaxPlaytimeMinutes);
        readBoolean(props.getProperty("smartlists.two.phase.enabled"))
                .ifPresent(builder::twoPhaseFiltering);

        readInt(env.apply("SMARTLISTS_BATCH_SIZE"), "SMARTLISTS_BATCH_SIZE")
                .ifPresent(builder::processingBatchSize);
        readInt(env.apply("SMARTLISTS_WORKER_THREADS"), "SMARTLISTS_WORKER_THREADS")
                .ifPresent(builder::workerThreads);
        readLong(env.apply("SMARTLISTS_REGEX_TIMEOUT_MS"), "SMARTLISTS_REGEX_TIMEOUT_MS")
                .ifPresent(builder::regexTimeoutMillis);
        readInt(env.apply("SMARTLISTS_DEFAULT_MAX_ITEMS"), "SMARTLISTS_DEFAULT_MAX_ITEMS")
                .ifPresent(builder::defaultMaxItems);
        readInt(env.apply("SMARTLISTS_DEFAULT_MAX_PLAYTIME_MINUTES"), "SMARTLISTS_DEFAULT_MAX_PLAYTIME_MINUTES")
                .ifPresent(builder::defaultMaxPlaytimeMinutes);
        readBoolean(env.apply("SMARTLISTS_TWO_PHASE_ENABLED"))
                .ifPresent(builder::twoPhaseFiltering);

        return builder.build();
    }

    private static Optional<Integer> readInt(String value, String key) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}", key, value);
            return Optional.empty();
        }
    }

    private static Optional<Long> readLong(String value, String key) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}", key, value);
            return Optional.empty();
        }
    }

    private static Optional<Boolean> readBoolean(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        return Optional.of(Boolean.parseBoolean(value.trim()));
    }

    @Override
    public String toString() {
        return "EngineConfig{batchSize=" + processingBatchSize
                + ", workerThreads=" + workerThreads
                + ", regexTimeoutMs=" + regexTimeoutMillis
                + ", defaultMaxItems=" + defaultMaxItems
                + ", defaultMaxPlaytimeMinutes=" + defaultMaxPlaytimeMinutes
                + ", twoPhaseFiltering=" + twoPhaseFiltering + "}";
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════════════

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int processingBatchSize = DEFAULT_BATCH_SIZE;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private long regexTimeoutMillis = DEFAULT_REGEX_TIMEOUT_MILLIS;
        private int defaultMaxItems = DEFAULT_MAX_ITEMS;
        private int defaultMaxPlaytimeMinutes = DEFAULT_MAX_PLAYTIME_MINUTES;
        private boolean twoPhaseFiltering = true;

        private Builder() {
        }

        /**
         * Values below 1 fall back to {@value EngineConfig#DEFAULT_BATCH_SIZE}.
         */
        public Builder processingBatchSize(int size) {
            if (size < 1) {
                logger.warn("Invalid processing batch size {}, using {}", size, DEFAULT_BATCH_SIZE);
                size = DEFAULT_BATCH_SIZE;
            }
            this.processingBatchSize = size;
            return this;
        }

        public Builder workerThreads(int threads) {
            this.workerThreads = Math.max(1, threads);
            return this;
        }

        public Builder regexTimeoutMillis(long millis) {
            if (millis <= 0) {
                logger.warn("Invalid regex timeout {} ms, using {}", millis, DEFAULT_REGEX_TIMEOUT_MILLIS);
                millis = DEFAULT_REGEX_TIMEOUT_MILLIS;
            }
            this.regexTimeoutMillis = millis;
            return this;
        }

        public Builder defaultMaxItems(int maxItems) {
            this.defaultMaxItems = Math.max(0, maxItems);
            return this;
        }

        public Builder defaultMaxPlaytimeMinutes(int minutes) {
            this.defaultMaxPlaytimeMinutes = Math.max(0, minutes);
            return this;
        }

        public Builder twoPhaseFiltering(boolean enabled) {
            this.twoPhaseFiltering = enabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
