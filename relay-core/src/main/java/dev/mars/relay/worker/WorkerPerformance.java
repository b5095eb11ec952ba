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

package dev.mars.relay.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Running performance figures of a worker.
 * Immutable; {@link #record(boolean, long)} returns the updated figures.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class WorkerPerformance {

    public static final WorkerPerformance INITIAL = new WorkerPerformance(1.0, 0.0, 0L);

    @JsonProperty("successRate")
    private final double successRate;

    @JsonProperty("averageResponseTimeMs")
    private final double averageResponseTimeMs;

    @JsonProperty("tasksCompleted")
    private final long tasksCompleted;

    public WorkerPerformance(double successRate, double averageResponseTimeMs, long tasksCompleted) {
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("Success rate must be within [0, 1]: " + successRate);
        }
        if (averageResponseTimeMs < 0.0) {
            throw new IllegalArgumentException("Average response time cannot be negative: " + averageResponseTimeMs);
        }
        if (tasksCompleted < 0) {
            throw new IllegalArgumentException("Tasks completed cannot be negative: " + tasksCompleted);
        }
        this.successRate = successRate;
        this.averageResponseTimeMs = averageResponseTimeMs;
        this.tasksCompleted = tasksCompleted;
    }

    /**
     * Fold one finished execution into the running means.
     *
     * @param success whether the execution succeeded
     * @param responseTimeMs time from dispatch to completion; negative values count as zero
     */
    public WorkerPerformance record(boolean success, long responseTimeMs) {
        long count = tasksCompleted + 1;
        double successes = successRate * tasksCompleted + (success ? 1 : 0);
        double totalTime = averageResponseTimeMs * tasksCompleted + Math.max(0L, responseTimeMs);
        double rate = Math.min(1.0, Math.max(0.0, successes / count));
        return new WorkerPerformance(rate, totalTime / count, count);
    }

    public double getSuccessRate() {
        return successRate;
    }

    public double getAverageResponseTimeMs() {
        return averageResponseTimeMs;
    }

    public long getTasksCompleted() {
        return tasksCompleted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerPerformance that = (WorkerPerformance) o;
        return Double.compare(that.successRate, successRate) == 0
                && Double.compare(that.averageResponseTimeMs, averageResponseTimeMs) == 0
                && tasksCompleted == that.tasksCompleted;
    }

    @Override
    public int hashCode() {
        return Objects.hash(successRate, averageResponseTimeMs, tasksCompleted);
    }

    @Override
    public String toString() {
        return String.format("WorkerPerformance{successRate=%.3f, avgResponseMs=%.1f, completed=%d}",
                successRate, averageResponseTimeMs, tasksCompleted);
    }
}
