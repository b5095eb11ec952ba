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

package dev.mars.relay.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TaskStatus} and {@link TaskPriority}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("Task status and priority")
class TaskStatusTest {

    @ParameterizedTest(name = "{0} -> {1} allowed={2}")
    @CsvSource({
            "PENDING, ASSIGNED, true",
            "PENDING, PENDING, true",
            "PENDING, IN_PROGRESS, false",
            "ASSIGNED, IN_PROGRESS, true",
            "ASSIGNED, PENDING, true",
            "ASSIGNED, COMPLETED, false",
            "IN_PROGRESS, COMPLETED, true",
            "IN_PROGRESS, FAILED, true",
            "IN_PROGRESS, PENDING, true",
            "IN_PROGRESS, ASSIGNED, false",
            "FAILED, PENDING, true",
            "FAILED, COMPLETED, false",
            "COMPLETED, PENDING, false"
    })
    @DisplayName("Transition table")
    void transitionTable(TaskStatus from, TaskStatus to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    @DisplayName("Completed is a dead end")
    void completedHasNoTransitions() {
        assertTrue(TaskStatus.COMPLETED.getValidTransitions().isEmpty());
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertFalse(TaskStatus.COMPLETED.isActive());
    }

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    @DisplayName("Values parse back to the same status")
    void fromValueRoundTrip(TaskStatus status) {
        assertEquals(status, TaskStatus.fromValue(status.getValue()));
        assertEquals(status, TaskStatus.fromValue(status.name()));
    }

    @Test
    @DisplayName("Unknown status value is rejected")
    void unknownStatusRejected() {
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromValue("paused"));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromValue(null));
    }

    @Test
    @DisplayName("Priority weights order the tiers")
    void priorityWeights() {
        assertTrue(TaskPriority.CRITICAL.isHigherThan(TaskPriority.HIGH));
        assertTrue(TaskPriority.HIGH.isHigherThan(TaskPriority.MEDIUM));
        assertTrue(TaskPriority.LOW.isLowerThan(TaskPriority.MEDIUM));
        assertEquals(4, TaskPriority.CRITICAL.getWeight());
        assertEquals(1, TaskPriority.LOW.getWeight());
    }

    @Test
    @DisplayName("Only low priority is excluded from retries")
    void retryableTiers() {
        assertFalse(TaskPriority.LOW.isRetryable());
        assertTrue(TaskPriority.MEDIUM.isRetryable());
        assertTrue(TaskPriority.HIGH.isRetryable());
        assertTrue(TaskPriority.CRITICAL.isRetryable());
    }

    @ParameterizedTest
    @CsvSource({"low, LOW", "HIGH, HIGH", " critical , CRITICAL", "2, MEDIUM", "4, CRITICAL"})
    @DisplayName("Priority parses names and weights")
    void priorityFromString(String input, TaskPriority expected) {
        assertEquals(expected, TaskPriority.fromString(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"urgent", "7", "12"})
    @DisplayName("Unknown priorities are rejected")
    void priorityFromStringRejects(String input) {
        assertThrows(IllegalArgumentException.class, () -> TaskPriority.fromString(input));
    }

    @Test
    @DisplayName("Blank priority defaults to medium")
    void blankPriorityDefaultsToMedium() {
        assertEquals(TaskPriority.MEDIUM, TaskPriority.fromString("  "));
        assertEquals(TaskPriority.MEDIUM, TaskPriority.fromString(null));
    }
}
