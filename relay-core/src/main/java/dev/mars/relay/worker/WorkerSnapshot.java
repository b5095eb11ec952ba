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

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable copy of a {@link WorkerRegistration} returned to callers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class WorkerSnapshot {

    private final String workerId;
    private final String workerType;
    private final Set<String> capabilities;
    private final Availability availability;
    private final Instant lastActivity;
    private final WorkerPerformance performance;
    private final String currentTaskId;
    private final Instant registeredAt;

    WorkerSnapshot(String workerId, String workerType, Set<String> capabilities, Availability availability,
                   Instant lastActivity, WorkerPerformance performance, String currentTaskId,
                   Instant registeredAt) {
        this.workerId = workerId;
        this.workerType = workerType;
        this.capabilities = capabilities;
        this.availability = availability;
        this.lastActivity = lastActivity;
        this.performance = performance;
        this.currentTaskId = currentTaskId;
        this.registeredAt = registeredAt;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getWorkerType() {
        return workerType;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public Availability getAvailability() {
        return availability;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public WorkerPerformance getPerformance() {
        return performance;
    }

    public Optional<String> getCurrentTaskId() {
        return Optional.ofNullable(currentTaskId);
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    @Override
    public String toString() {
        return "WorkerSnapshot{" +
                "workerId='" + workerId + '\'' +
                ", type='" + workerType + '\'' +
                ", availability=" + availability +
                ", capabilities=" + capabilities +
                ", performance=" + performance +
                '}';
    }
}
