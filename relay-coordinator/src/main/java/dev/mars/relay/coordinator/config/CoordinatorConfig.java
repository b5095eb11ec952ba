/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.relay.coordinator.config;

import dev.mars.relay.coordinator.service.SelectionWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Configuration of a coordinator instance.
 *
 * <p>Loads {@code relay-coordinator.properties} from the classpath. Every key can be
 * overridden; resolution order, highest priority first:</p>
 * <ol>
 *   <li>Explicit overrides passed to the constructor</li>
 *   <li>Environment variable (e.g. {@code RELAY_SCHEDULER_INTERVAL_MS})</li>
 *   <li>System property (e.g. {@code -Drelay.scheduler.interval.ms=500})</li>
 *   <li>Properties file</li>
 *   <li>Built-in default</li>
 * </ol>
 *
 * <p>Each coordinator owns its own instance, so two coordinators in one process can
 * run with different settings.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class CoordinatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(CoordinatorConfig.class);
    static final String CONFIG_FILE = "relay-coordinator.properties";

    public static final String SCHEDULER_INTERVAL_MS = "relay.scheduler.interval.ms";
    public static final String SCHEDULER_MAX_RETRIES = "relay.scheduler.max-retries";
    public static final String RETRY_MAX_HANDOFFS = "relay.retry.max-handoffs";
    public static final String HEALTH_INTERVAL_MS = "relay.health.interval.ms";
    public static final String HEALTH_INACTIVITY_THRESHOLD_MS = "relay.health.inactivity-threshold.ms";
    public static final String HANDOFF_HISTORY_WINDOW = "relay.handoff.history-window";
    public static final String HANDOFF_DEFAULT_RULES_ENABLED = "relay.handoff.default-rules.enabled";
    public static final String SELECTION_WEIGHT_CAPABILITY = "relay.selection.weight.capability";
    public static final String SELECTION_WEIGHT_PERFORMANCE = "relay.selection.weight.performance";
    public static final String SELECTION_WEIGHT_SUCCESS_RATE = "relay.selection.weight.success-rate";
    public static final String SELECTION_WEIGHT_RESPONSE_TIME = "relay.selection.weight.response-time";
    public static final String SELECTION_REFERENCE_LATENCY_MS = "relay.selection.reference-latency.ms";

    private final Properties properties = new Properties();
    private final Map<String, String> overrides;
    private final UnaryOperator<String> environment;

    public CoordinatorConfig() {
        this(Collections.emptyMap());
    }

    public CoordinatorConfig(Map<String, String> overrides) {
        this(overrides, System::getenv);
    }

    CoordinatorConfig(Map<String, String> overrides, UnaryOperator<String> environment) {
        this.overrides = Collections.unmodifiableMap(new HashMap<>(overrides));
        this.environment = environment;
        loadProperties();
    }

    /**
     * Copy of this configuration with one more explicit override.
     */
    public CoordinatorConfig with(String key, Object value) {
        Map<String, String> merged = new HashMap<>(overrides);
        merged.put(key, String.valueOf(value));
        return new CoordinatorConfig(merged, environment);
    }

    // ==================== Scheduler ====================

    public long getSchedulerIntervalMs() {
        return getPositiveLong(SCHEDULER_INTERVAL_MS, 1000L);
    }

    /**
     * Upper bound on retries of one task; 0 leaves only the handoff and priority rules.
     */
    public int getMaxRetries() {
        return Math.max(0, getInt(SCHEDULER_MAX_RETRIES, 0));
    }

    /**
     * A failed task is retried only while its handoff history is shorter than this.
     */
    public int getMaxHandoffsForRetry() {
        return Math.max(0, getInt(RETRY_MAX_HANDOFFS, 3));
    }

    // ==================== Health ====================

    public long getHealthIntervalMs() {
        return getPositiveLong(HEALTH_INTERVAL_MS, 60_000L);
    }

    public long getInactivityThresholdMs() {
        return getPositiveLong(HEALTH_INACTIVITY_THRESHOLD_MS, 300_000L);
    }

    // ==================== Handoff ====================

    public int getHandoffHistoryWindow() {
        return Math.max(0, getInt(HANDOFF_HISTORY_WINDOW, 10));
    }

    public boolean isDefaultRulesEnabled() {
        return getBoolean(HANDOFF_DEFAULT_RULES_ENABLED, true);
    }

    // ==================== Selection ====================

    public SelectionWeights getSelectionWeights() {
        return new SelectionWeights.Builder()
                .capabilityWeight(getDouble(SELECTION_WEIGHT_CAPABILITY, SelectionWeights.DEFAULT_CAPABILITY_WEIGHT))
                .performanceWeight(getDouble(SELECTION_WEIGHT_PERFORMANCE, SelectionWeights.DEFAULT_PERFORMANCE_WEIGHT))
                .successRateWeight(getDouble(SELECTION_WEIGHT_SUCCESS_RATE, SelectionWeights.DEFAULT_SUCCESS_RATE_WEIGHT))
                .responseTimeWeight(getDouble(SELECTION_WEIGHT_RESPONSE_TIME, SelectionWeights.DEFAULT_RESPONSE_TIME_WEIGHT))
                .referenceLatencyMs(getDouble(SELECTION_REFERENCE_LATENCY_MS, SelectionWeights.DEFAULT_REFERENCE_LATENCY_MS))
                .build();
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        String override = overrides.get(key);
        if (override != null && !override.isEmpty()) {
            return override;
        }

        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = environment.apply(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Log the effective settings at INFO.
     */
    public void logConfiguration() {
        logger.info("=== Relay Coordinator Configuration ===");
        logger.info("  Scheduler Interval:   {}ms", getSchedulerIntervalMs());
        logger.info("  Max Retries:          {}", getMaxRetries() == 0 ? "unbounded" : getMaxRetries());
        logger.info("  Retry Handoff Limit:  {}", getMaxHandoffsForRetry());
        logger.info("  Health Interval:      {}ms", getHealthIntervalMs());
        logger.info("  Inactivity Threshold: {}ms", getInactivityThresholdMs());
        logger.info("  History Window:       {}", getHandoffHistoryWindow());
        logger.info("  Default Rules:        {}", isDefaultRulesEnabled());
        logger.info("  Selection Weights:    {}", getSelectionWeights());
        logger.info("=======================================");
    }

    // ==================== Private Helpers ====================

    private long getPositiveLong(String key, long defaultValue) {
        long value = getLong(key, defaultValue);
        if (value <= 0) {
            logger.warn("Value for {} must be positive, got {}; using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file {}: {}", CONFIG_FILE, e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }
}
