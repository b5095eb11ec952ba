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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoordinatorConfig")
class CoordinatorConfigTest {

    private static final UnaryOperator<String> NO_ENV = key -> null;

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Values from the bundled properties file")
        void bundledDefaults() {
            CoordinatorConfig config = new CoordinatorConfig(Map.of(), NO_ENV);

            assertEquals(1000L, config.getSchedulerIntervalMs());
            assertEquals(0, config.getMaxRetries());
            assertEquals(3, config.getMaxHandoffsForRetry());
            assertEquals(60_000L, config.getHealthIntervalMs());
            assertEquals(300_000L, config.getInactivityThresholdMs());
            assertEquals(10, config.getHandoffHistoryWindow());
            assertTrue(config.isDefaultRulesEnabled());
            assertEquals(SelectionWeights.DEFAULTS, config.getSelectionWeights());
        }

        @Test
        @DisplayName("Unknown keys use the caller's default")
        void unknownKey() {
            CoordinatorConfig config = new CoordinatorConfig(Map.of(), NO_ENV);

            assertEquals("fallback", config.getString("relay.unknown", "fallback"));
            assertEquals(7, config.getInt("relay.unknown", 7));
        }
    }

    @Nested
    @DisplayName("Resolution order")
    class ResolutionTests {

        @Test
        @DisplayName("Environment variable beats the properties file")
        void environmentVariable() {
            CoordinatorConfig config = new CoordinatorConfig(Map.of(),
                    key -> "RELAY_SCHEDULER_INTERVAL_MS".equals(key) ? "250" : null);

            assertEquals(250L, config.getSchedulerIntervalMs());
        }

        @Test
        @DisplayName("Dashes in keys map to underscores in environment names")
        void environmentNameMapping() {
            CoordinatorConfig config = new CoordinatorConfig(Map.of(),
                    key -> "RELAY_HEALTH_INACTIVITY_THRESHOLD_MS".equals(key) ? "1500" : null);

            assertEquals(1500L, config.getInactivityThresholdMs());
        }

        @Test
        @DisplayName("Explicit override beats the environment")
        void overrideBeatsEnvironment() {
            CoordinatorConfig config = new CoordinatorConfig(
                    Map.of(CoordinatorConfig.SCHEDULER_INTERVAL_MS, "50"),
                    key -> "RELAY_SCHEDULER_INTERVAL_MS".equals(key) ? "250" : null);

            assertEquals(50L, config.getSchedulerIntervalMs());
        }

        @Test
        @DisplayName("System property beats the properties file")
        void systemProperty() {
            System.setProperty(CoordinatorConfig.HANDOFF_HISTORY_WINDOW, "4");
            try {
                assertEquals(4, new CoordinatorConfig(Map.of(), NO_ENV).getHandoffHistoryWindow());
            } finally {
                System.clearProperty(CoordinatorConfig.HANDOFF_HISTORY_WINDOW);
            }
        }

        @Test
        @DisplayName("with() adds an override without touching the original")
        void with() {
            CoordinatorConfig base = new CoordinatorConfig(Map.of(), NO_ENV);

            CoordinatorConfig changed = base.with(CoordinatorConfig.SCHEDULER_MAX_RETRIES, 5);

            assertEquals(5, changed.getMaxRetries());
            assertEquals(0, base.getMaxRetries());
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class InvalidValueTests {

        @Test
        @DisplayName("Unparseable numbers fall back to the default")
        void unparseable() {
            CoordinatorConfig config = new CoordinatorConfig(Map.of(
                    CoordinatorConfig.SCHEDULER_INTERVAL_MS, "soon",
                    CoordinatorConfig.SELECTION_WEIGHT_CAPABILITY, "lots"), NO_ENV);

            assertEquals(1000L, config.getSchedulerIntervalMs());
            assertEquals(SelectionWeights.DEFAULT_CAPABILITY_WEIGHT,
                    config.getSelectionWeights().getCapabilityWeight());
        }

        @Test
        @DisplayName("Intervals must be positive and counts non-negative")
        void outOfRange() {
            CoordinatorConfig config = new CoordinatorConfig(Map.of(
                    CoordinatorConfig.SCHEDULER_INTERVAL_MS, "0",
                    CoordinatorConfig.HEALTH_INTERVAL_MS, "-10",
                    CoordinatorConfig.SCHEDULER_MAX_RETRIES, "-2",
                    CoordinatorConfig.HANDOFF_HISTORY_WINDOW, "-1"), NO_ENV);

            assertEquals(1000L, config.getSchedulerIntervalMs());
            assertEquals(60_000L, config.getHealthIntervalMs());
            assertEquals(0, config.getMaxRetries());
            assertEquals(0, config.getHandoffHistoryWindow());
        }

        @Test
        @DisplayName("Negative selection weights are rejected")
        void negativeWeight() {
            CoordinatorConfig config = new CoordinatorConfig(
                    Map.of(CoordinatorConfig.SELECTION_WEIGHT_PERFORMANCE, "-0.5"), NO_ENV);

            assertThrows(IllegalArgumentException.class, config::getSelectionWeights);
        }
    }
}
