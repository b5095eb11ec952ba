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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, consistent copy of a {@link TaskRecord} handed to callers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class TaskSnapshot {

    private final String taskId;
    private final Set<String> requiredCapabilities;
    private final TaskPriority priority;
    private final Instant deadline;
    private final TaskContext context;
    private final TaskStatus status;
    private final String assignedWorker;
    private final WorkerResult result;
    private final List<HandoffEvent> handoffHistory;
    private final Instant submittedAt;
    private final Instant dispatchedAt;
    private final Instant completedAt;
    private final int attempts;
    private final int retryCount;

    TaskSnapshot(String taskId, Set<String> requiredCapabilities, TaskPriority priority, Instant deadline,
                 TaskContext context, TaskStatus status, String assignedWorker, WorkerResult result,
                 List<HandoffEvent> handoffHistory, Instant submittedAt, Instant dispatchedAt,
                 Instant completedAt, int attempts, int retryCount) {
        this.taskId = taskId;
        this.requiredCapabilities = requiredCapabilities;
        this.priority = priority;
        this.deadline = deadline;
        this.context = context;
        this.status = status;
        this.assignedWorker = assignedWorker;
        this.result = result;
        this.handoffHistory = handoffHistory;
        this.submittedAt = submittedAt;
        this.dispatchedAt = dispatchedAt;
        this.completedAt = completedAt;
        this.attempts = attempts;
        this.retryCount = retryCount;
    }

    public String getTaskId() {
        return taskId;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public TaskContext getContext() {
        return context;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public Optional<String> getAssignedWorker() {
        return Optional.ofNullable(assignedWorker);
    }

    public Optional<WorkerResult> getResult() {
        return Optional.ofNullable(result);
    }

    public List<HandoffEvent> getHandoffHistory() {
        return handoffHistory;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Optional<Instant> getDispatchedAt() {
        return Optional.ofNullable(dispatchedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    /**
     * Number of executions started for this task, handoffs included.
     */
    public int getAttempts() {
        return attempts;
    }

    public int getRetryCount() {
        return retryCount;
    }

    @Override
    public String toString() {
        return "TaskSnapshot{" +
                "taskId='" + taskId + '\'' +
                ", status=" + status +
                ", assignedWorker='" + assignedWorker + '\'' +
                ", priority=" + priority +
                ", handoffs=" + handoffHistory.size() +
                ", attempts=" + attempts +
                '}';
    }
}
