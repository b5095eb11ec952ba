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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a task inside the coordinator.
 *
 * <pre>
 *   PENDING     → ASSIGNED, PENDING
 *   ASSIGNED    → IN_PROGRESS, PENDING
 *   IN_PROGRESS → COMPLETED, FAILED, PENDING
 *   FAILED      → PENDING (authorised retry only)
 *   COMPLETED   → (terminal)
 * </pre>
 *
 * <p>{@code IN_PROGRESS → PENDING} is the requeue path used when the executing
 * worker is unregistered or found unresponsive. {@code ASSIGNED → PENDING} rolls
 * back a commit whose worker was lost between selection and dispatch.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum TaskStatus {

    PENDING("pending", "Task is waiting in the queue for a worker"),

    ASSIGNED("assigned", "Task has been matched to a worker"),

    IN_PROGRESS("in_progress", "Task is executing on its assigned worker"),

    COMPLETED("completed", "Task finished successfully"),

    FAILED("failed", "Task execution failed");

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<TaskStatus, Set<TaskStatus>>(TaskStatus.class);
        map.put(PENDING, EnumSet.of(ASSIGNED, PENDING));
        map.put(ASSIGNED, EnumSet.of(IN_PROGRESS, PENDING));
        map.put(IN_PROGRESS, EnumSet.of(COMPLETED, FAILED, PENDING));
        map.put(FAILED, EnumSet.of(PENDING));
        map.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    TaskStatus(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Check if the task holds a worker in this status.
     */
    public boolean isActive() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }

    /**
     * Terminal from the submitter's point of view. {@code FAILED} may still be
     * revived by the retry policy before the submitter observes it.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(TaskStatus.class)).contains(target);
    }

    public Set<TaskStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    public static TaskStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status value must not be null");
        }
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
