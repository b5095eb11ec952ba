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

import dev.mars.relay.core.exceptions.InvalidTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable record of a task owned by the coordinator.
 *
 * <h3>Thread Safety:</h3>
 * <p>Every mutation of status, assignment, result or handoff history happens under
 * this record's own {@link ReentrantLock}, so updates to different tasks never
 * contend with each other. Readers that need a consistent view should use
 * {@link #snapshot()}.</p>
 *
 * <h3>Dispatch sequence:</h3>
 * <p>Each execution started for the task is stamped with a monotonically increasing
 * dispatch sequence. A handoff or requeue supersedes the current dispatch, and
 * {@link #complete(long, WorkerResult)} ignores results carrying an older sequence.
 * This keeps a slow worker from overwriting the outcome of the worker that
 * replaced it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 * @see TaskStatus
 * @see TaskSnapshot
 */
public class TaskRecord {

    private final ReentrantLock lock = new ReentrantLock();

    private final String taskId;
    private final Set<String> requiredCapabilities;
    private final TaskPriority priority;
    private final Instant deadline;
    private final Instant submittedAt;
    private final long submissionSequence;

    private TaskContext context;
    private TaskStatus status = TaskStatus.PENDING;
    private String assignedWorker;
    private WorkerResult result;
    private final List<HandoffEvent> handoffHistory = new ArrayList<>();
    private String openHandoffEventId;
    private Instant dispatchedAt;
    private Instant completedAt;
    private long dispatchSequence;
    private int attempts;
    private int retryCount;

    private TaskRecord(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "Task id cannot be null");
        this.requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredCapabilities));
        this.priority = builder.priority != null ? builder.priority : TaskPriority.MEDIUM;
        this.deadline = builder.deadline;
        this.context = builder.context != null ? builder.context : TaskContext.of("");
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.submissionSequence = builder.submissionSequence;
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

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    /**
     * Order in which the task was submitted. Used as the final queue tie-breaker.
     */
    public long getSubmissionSequence() {
        return submissionSequence;
    }

    public TaskContext getContext() {
        lock.lock();
        try {
            return context;
        } finally {
            lock.unlock();
        }
    }

    public TaskStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getAssignedWorker() {
        lock.lock();
        try {
            return Optional.ofNullable(assignedWorker);
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkerResult> getResult() {
        lock.lock();
        try {
            return Optional.ofNullable(result);
        } finally {
            lock.unlock();
        }
    }

    public List<HandoffEvent> getHandoffHistory() {
        lock.lock();
        try {
            return List.copyOf(handoffHistory);
        } finally {
            lock.unlock();
        }
    }

    public int getHandoffCount() {
        lock.lock();
        try {
            return handoffHistory.size();
        } finally {
            lock.unlock();
        }
    }

    public long getDispatchSequence() {
        lock.lock();
        try {
            return dispatchSequence;
        } finally {
            lock.unlock();
        }
    }

    public int getRetryCount() {
        lock.lock();
        try {
            return retryCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commit the task to a worker: {@code PENDING → ASSIGNED}.
     *
     * @param workerId the reserved worker
     * @throws InvalidTransitionException if the task is not pending
     */
    public void assign(String workerId) throws InvalidTransitionException {
        assign(workerId, null, null);
    }

    /**
     * Commit the task to a worker that a handoff rule chose in place of the
     * originally selected one. The routing event is appended to the handoff history
     * and settles together with the first dispatch.
     *
     * @param workerId the reserved worker
     * @param routing handoff event describing the redirection, or {@code null}
     * @param routedContext context the worker receives, or {@code null} to keep the current one
     * @throws InvalidTransitionException if the task is not pending
     */
    public void assign(String workerId, HandoffEvent routing, TaskContext routedContext)
            throws InvalidTransitionException {
        Objects.requireNonNull(workerId, "Worker id cannot be null");
        lock.lock();
        try {
            transition(TaskStatus.ASSIGNED);
            assignedWorker = workerId;
            if (routing != null) {
                handoffHistory.add(routing);
                openHandoffEventId = routing.getEventId();
            }
            if (routedContext != null) {
                context = routedContext;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start execution on the assigned worker: {@code ASSIGNED → IN_PROGRESS}.
     *
     * @return the dispatch sequence stamped on this execution
     * @throws InvalidTransitionException if the task is not assigned
     */
    public long beginExecution() throws InvalidTransitionException {
        lock.lock();
        try {
            transition(TaskStatus.IN_PROGRESS);
            return stampDispatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move an executing task to another worker. The current dispatch is superseded
     * and any handoff still waiting for its outcome is settled as unsuccessful.
     *
     * @param event the placeholder event for this transfer
     * @param newContext the context the receiving worker gets
     * @return the dispatch sequence of the re-dispatched execution
     * @throws InvalidTransitionException if the task is not in progress
     */
    public long handOff(HandoffEvent event, TaskContext newContext) throws InvalidTransitionException {
        Objects.requireNonNull(event, "Handoff event cannot be null");
        lock.lock();
        try {
            if (status != TaskStatus.IN_PROGRESS) {
                throw new InvalidTransitionException(taskId, status, TaskStatus.IN_PROGRESS,
                        status.getValidTransitions());
            }
            settleOpenHandoff(false);
            handoffHistory.add(event);
            openHandoffEventId = event.getEventId();
            assignedWorker = event.getToWorker();
            if (newContext != null) {
                context = newContext;
            }
            return stampDispatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record the outcome of an execution. Results from a superseded dispatch, or
     * arriving when the task is no longer in progress, are ignored.
     *
     * @param sequence the dispatch sequence the result belongs to
     * @param workerResult the worker's result
     * @return what the completion changed
     */
    public Settlement complete(long sequence, WorkerResult workerResult) {
        Objects.requireNonNull(workerResult, "Worker result cannot be null");
        lock.lock();
        try {
            if (sequence != dispatchSequence || status != TaskStatus.IN_PROGRESS) {
                return Settlement.IGNORED;
            }
            status = workerResult.isSuccess() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
            result = workerResult;
            completedAt = Instant.now();
            HandoffEvent settledHandoff = settleOpenHandoff(workerResult.isSuccess());
            return new Settlement(true, status, assignedWorker, dispatchedAt, settledHandoff);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put an assigned or executing task back to {@code PENDING} with no worker.
     * The current dispatch is superseded.
     *
     * @return the worker that held the task, if any
     * @throws InvalidTransitionException if the task is terminal
     */
    public Optional<String> requeue() throws InvalidTransitionException {
        lock.lock();
        try {
            if (status.isTerminal()) {
                throw new InvalidTransitionException(taskId, status, TaskStatus.PENDING,
                        status.getValidTransitions());
            }
            String previous = assignedWorker;
            transition(TaskStatus.PENDING);
            assignedWorker = null;
            dispatchSequence++;
            settleOpenHandoff(false);
            return Optional.ofNullable(previous);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Revive a failed task: {@code FAILED → PENDING}.
     *
     * @throws InvalidTransitionException if the task has not failed
     */
    public void retry() throws InvalidTransitionException {
        lock.lock();
        try {
            if (status != TaskStatus.FAILED) {
                throw new InvalidTransitionException(taskId, status, TaskStatus.PENDING,
                        status.getValidTransitions());
            }
            transition(TaskStatus.PENDING);
            assignedWorker = null;
            result = null;
            completedAt = null;
            retryCount++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Immutable view of the current state.
     */
    public TaskSnapshot snapshot() {
        lock.lock();
        try {
            return new TaskSnapshot(taskId, requiredCapabilities, priority, deadline, context, status,
                    assignedWorker, result, List.copyOf(handoffHistory), submittedAt, dispatchedAt,
                    completedAt, attempts, retryCount);
        } finally {
            lock.unlock();
        }
    }

    private void transition(TaskStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(taskId, status, target, status.getValidTransitions());
        }
        status = target;
    }

    private long stampDispatch() {
        dispatchSequence++;
        attempts++;
        dispatchedAt = Instant.now();
        return dispatchSequence;
    }

    private HandoffEvent settleOpenHandoff(boolean success) {
        if (openHandoffEventId == null) {
            return null;
        }
        for (int i = handoffHistory.size() - 1; i >= 0; i--) {
            HandoffEvent event = handoffHistory.get(i);
            if (event.getEventId().equals(openHandoffEventId)) {
                long duration = Duration.between(event.getTimestamp(), Instant.now()).toMillis();
                HandoffEvent settled = event.settle(success, duration);
                handoffHistory.set(i, settled);
                openHandoffEventId = null;
                return settled;
            }
        }
        openHandoffEventId = null;
        return null;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "TaskRecord{" +
                    "taskId='" + taskId + '\'' +
                    ", status=" + status +
                    ", priority=" + priority +
                    ", assignedWorker='" + assignedWorker + '\'' +
                    ", handoffs=" + handoffHistory.size() +
                    '}';
        } finally {
            lock.unlock();
        }
    }

    /**
     * Result of {@link #complete(long, WorkerResult)}.
     */
    public static final class Settlement {

        static final Settlement IGNORED = new Settlement(false, null, null, null, null);

        private final boolean accepted;
        private final TaskStatus status;
        private final String workerId;
        private final Instant dispatchedAt;
        private final HandoffEvent settledHandoff;

        Settlement(boolean accepted, TaskStatus status, String workerId, Instant dispatchedAt,
                   HandoffEvent settledHandoff) {
            this.accepted = accepted;
            this.status = status;
            this.workerId = workerId;
            this.dispatchedAt = dispatchedAt;
            this.settledHandoff = settledHandoff;
        }

        /**
         * False when the result belonged to a superseded dispatch.
         */
        public boolean isAccepted() {
            return accepted;
        }

        public TaskStatus getStatus() {
            return status;
        }

        public String getWorkerId() {
            return workerId;
        }

        public Instant getDispatchedAt() {
            return dispatchedAt;
        }

        public Optional<HandoffEvent> getSettledHandoff() {
            return Optional.ofNullable(settledHandoff);
        }
    }

    /**
     * Builder for creating TaskRecord instances.
     */
    public static class Builder {
        private String taskId;
        private final Set<String> requiredCapabilities = new LinkedHashSet<>();
        private TaskPriority priority = TaskPriority.MEDIUM;
        private Instant deadline;
        private TaskContext context;
        private Instant submittedAt;
        private long submissionSequence;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder requiredCapabilities(Iterable<String> capabilities) {
            this.requiredCapabilities.clear();
            if (capabilities != null) {
                capabilities.forEach(this.requiredCapabilities::add);
            }
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder context(TaskContext context) {
            this.context = context;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder submissionSequence(long submissionSequence) {
            this.submissionSequence = submissionSequence;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(this);
        }
    }
}
