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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority tiers for tasks waiting in the coordinator queue.
 * The weight drives queue ordering: higher weights are dequeued first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum TaskPriority {

    /**
     * Background work. Never retried after a failure.
     */
    LOW("low", 1, "Low priority - background processing"),

    /**
     * The default tier for submitted tasks.
     */
    MEDIUM("medium", 2, "Medium priority - standard processing"),

    /**
     * Processed ahead of medium and low tasks.
     */
    HIGH("high", 3, "High priority - expedited processing"),

    /**
     * Processed ahead of everything else at the next assignment opportunity.
     */
    CRITICAL("critical", 4, "Critical priority - immediate processing");

    private final String value;
    private final int weight;
    private final String description;

    TaskPriority(String value, int weight, String description) {
        this.value = value;
        this.weight = weight;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Get the ordering weight of this tier. Higher values are dequeued first.
     */
    public int getWeight() {
        return weight;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Check if this priority is higher than another priority.
     *
     * @param other the priority to compare against
     * @return true if this priority is higher
     */
    public boolean isHigherThan(TaskPriority other) {
        return this.weight > other.weight;
    }

    /**
     * Check if this priority is lower than another priority.
     *
     * @param other the priority to compare against
     * @return true if this priority is lower
     */
    public boolean isLowerThan(TaskPriority other) {
        return this.weight < other.weight;
    }

    /**
     * Whether a failed task of this tier may be put back on the queue at all.
     */
    public boolean isRetryable() {
        return this != LOW;
    }

    /**
     * Parse a priority from a string value.
     * Case-insensitive; accepts the tier name or its numeric weight.
     *
     * @param value the string value to parse
     * @return the corresponding TaskPriority, {@link #MEDIUM} for blank input
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static TaskPriority fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return MEDIUM;
        }

        String trimmed = value.trim();
        for (TaskPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(trimmed)) {
                return priority;
            }
        }

        if (trimmed.length() == 1 && Character.isDigit(trimmed.charAt(0))) {
            int numericValue = trimmed.charAt(0) - '0';
            for (TaskPriority priority : values()) {
                if (priority.weight == numericValue) {
                    return priority;
                }
            }
        }
        throw new IllegalArgumentException("Invalid task priority: " + value);
    }

    @Override
    public String toString() {
        return name() + " (" + weight + ")";
    }
}
