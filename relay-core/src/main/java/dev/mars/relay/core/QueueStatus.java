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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time summary of the coordinator's tasks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class QueueStatus {

    @JsonProperty("countsByStatus")
    private final Map<TaskStatus, Integer> countsByStatus;

    @JsonProperty("queueDepth")
    private final int queueDepth;

    @JsonProperty("totalTasks")
    private final int totalTasks;

    public QueueStatus(Map<TaskStatus, Integer> countsByStatus, int queueDepth) {
        EnumMap<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, countsByStatus.getOrDefault(status, 0));
        }
        this.countsByStatus = Collections.unmodifiableMap(counts);
        this.queueDepth = queueDepth;
        this.totalTasks = counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<TaskStatus, Integer> getCountsByStatus() {
        return countsByStatus;
    }

    public int getCount(TaskStatus status) {
        return countsByStatus.get(status);
    }

    public int getPending() {
        return getCount(TaskStatus.PENDING);
    }

    public int getInProgress() {
        return getCount(TaskStatus.IN_PROGRESS);
    }

    public int getCompleted() {
        return getCount(TaskStatus.COMPLETED);
    }

    public int getFailed() {
        return getCount(TaskStatus.FAILED);
    }

    /**
     * Number of tasks currently waiting in the queue.
     */
    public int getQueueDepth() {
        return queueDepth;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    @Override
    public String toString() {
        return "QueueStatus{counts=" + countsByStatus + ", queueDepth=" + queueDepth + '}';
    }
}
