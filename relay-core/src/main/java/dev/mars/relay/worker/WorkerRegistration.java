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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinator-side entry for one registered {@link Worker}.
 *
 * <h3>Thread Safety:</h3>
 * <p>Availability, current task, performance and activity time are guarded by
 * this entry's own lock. Reserving a worker for a task is a compare-and-set on
 * availability ({@link #tryReserve(String)}), so two tasks can never be committed
 * to the same worker.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkerRegistration {

    private final ReentrantLock lock = new ReentrantLock();

    private final Worker worker;
    private final String workerId;
    private final Instant registeredAt;
    private final long registrationOrder;

    private String workerType;
    private Set<String> capabilities;
    private Availability availability = Availability.AVAILABLE;
    private Instant lastActivity;
    private WorkerPerformance performance = WorkerPerformance.INITIAL;
    private String currentTaskId;
    private boolean retired;

    /**
     * @param worker the worker being registered
     * @param registrationOrder position of the worker in registration order, used to break selection ties
     */
    public WorkerRegistration(Worker worker, long registrationOrder) {
        this.worker = Objects.requireNonNull(worker, "Worker cannot be null");
        this.workerId = Objects.requireNonNull(worker.getWorkerId(), "Worker id cannot be null");
        this.registrationOrder = registrationOrder;
        this.registeredAt = Instant.now();
        this.lastActivity = registeredAt;
        readDeclaration();
    }

    private WorkerRegistration(Worker worker, WorkerRegistration previous) {
        this.worker = Objects.requireNonNull(worker, "Worker cannot be null");
        this.workerId = previous.workerId;
        this.registrationOrder = previous.registrationOrder;
        this.registeredAt = previous.registeredAt;
        this.availability = previous.availability;
        this.currentTaskId = previous.currentTaskId;
        this.performance = previous.performance;
        this.lastActivity = Instant.now();
        readDeclaration();
    }

    public Worker getWorker() {
        return worker;
    }

    public String getWorkerId() {
        return workerId;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public long getRegistrationOrder() {
        return registrationOrder;
    }

    public String getWorkerType() {
        lock.lock();
        try {
            return workerType;
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getCapabilities() {
        lock.lock();
        try {
            return capabilities;
        } finally {
            lock.unlock();
        }
    }

    public Availability getAvailability() {
        lock.lock();
        try {
            return availability;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAvailable() {
        return getAvailability() == Availability.AVAILABLE;
    }

    public Instant getLastActivity() {
        lock.lock();
        try {
            return lastActivity;
        } finally {
            lock.unlock();
        }
    }

    public WorkerPerformance getPerformance() {
        lock.lock();
        try {
            return performance;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getCurrentTaskId() {
        lock.lock();
        try {
            return Optional.ofNullable(currentTaskId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-read type and capabilities from the worker. Used when a worker registers again.
     */
    public void refresh() {
        lock.lock();
        try {
            readDeclaration();
            lastActivity = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand this entry over to another instance of the same worker. The new entry
     * keeps availability, the held task, performance and registration order; this
     * entry is retired and can no longer be reserved or made available.
     *
     * @param replacement the new instance, registered under the same id
     * @return the entry that replaces this one
     */
    public WorkerRegistration replaceWith(Worker replacement) {
        Objects.requireNonNull(replacement, "Worker cannot be null");
        if (!workerId.equals(replacement.getWorkerId())) {
            throw new IllegalArgumentException("Replacement for worker " + workerId
                    + " has id " + replacement.getWorkerId());
        }
        lock.lock();
        try {
            WorkerRegistration successor = new WorkerRegistration(replacement, this);
            retired = true;
            availability = Availability.OFFLINE;
            currentTaskId = null;
            return successor;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRetired() {
        lock.lock();
        try {
            return retired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserve the worker for a task if, and only if, it is available and holds no task.
     *
     * @param taskId the task being committed
     * @return true if the worker is now busy with {@code taskId}
     */
    public boolean tryReserve(String taskId) {
        Objects.requireNonNull(taskId, "Task id cannot be null");
        lock.lock();
        try {
            if (retired || availability != Availability.AVAILABLE || currentTaskId != null) {
                return false;
            }
            availability = Availability.BUSY;
            currentTaskId = taskId;
            lastActivity = Instant.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the worker from a task. A busy worker becomes available again; an
     * offline worker stays offline.
     *
     * @param taskId the task being released
     * @return true if the worker held {@code taskId} and went from busy to available
     */
    public boolean release(String taskId) {
        lock.lock();
        try {
            if (taskId == null || !taskId.equals(currentTaskId)) {
                return false;
            }
            currentTaskId = null;
            lastActivity = Instant.now();
            if (availability == Availability.BUSY) {
                availability = Availability.AVAILABLE;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Change availability. Making a worker available while it still holds a task is
     * refused.
     *
     * @param target the requested availability
     * @return the previous availability if it changed, empty if nothing changed
     */
    public Optional<Availability> changeAvailability(Availability target) {
        Objects.requireNonNull(target, "Availability cannot be null");
        lock.lock();
        try {
            if (retired || availability == target || !availability.canTransitionTo(target)) {
                return Optional.empty();
            }
            if (target == Availability.AVAILABLE && currentTaskId != null) {
                return Optional.empty();
            }
            Availability previous = availability;
            availability = target;
            lastActivity = Instant.now();
            return Optional.of(previous);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the worker offline and detach whatever task it held.
     *
     * @return the task the worker was holding, if any
     */
    public Optional<String> goOffline() {
        lock.lock();
        try {
            String held = currentTaskId;
            availability = Availability.OFFLINE;
            currentTaskId = null;
            return Optional.ofNullable(held);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the worker offline if it has shown no activity since {@code cutoff} and is
     * not offline already. Check and change happen under one lock acquisition.
     *
     * @return what the worker was doing when it was taken offline, empty if it was left alone
     */
    public Optional<Eviction> goOfflineIfInactiveSince(Instant cutoff) {
        Objects.requireNonNull(cutoff, "Cutoff cannot be null");
        lock.lock();
        try {
            if (retired || availability == Availability.OFFLINE || !lastActivity.isBefore(cutoff)) {
                return Optional.empty();
            }
            Eviction eviction = new Eviction(availability, lastActivity, currentTaskId);
            availability = Availability.OFFLINE;
            currentTaskId = null;
            return Optional.of(eviction);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fold a finished execution into the performance figures.
     */
    public WorkerPerformance recordExecution(boolean success, long responseTimeMs) {
        lock.lock();
        try {
            performance = performance.record(success, responseTimeMs);
            lastActivity = Instant.now();
            return performance;
        } finally {
            lock.unlock();
        }
    }

    public void touch() {
        lock.lock();
        try {
            lastActivity = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    public WorkerSnapshot snapshot() {
        lock.lock();
        try {
            return new WorkerSnapshot(workerId, workerType, capabilities, availability, lastActivity,
                    performance, currentTaskId, registeredAt);
        } finally {
            lock.unlock();
        }
    }

    private void readDeclaration() {
        String declaredType = worker.getWorkerType();
        workerType = declaredType != null && !declaredType.isBlank()
                ? declaredType
                : worker.getClass().getSimpleName();
        Set<String> declared = worker.listCapabilities();
        capabilities = declared != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(declared))
                : Collections.emptySet();
    }

    /**
     * State of a worker at the moment it was taken offline for inactivity.
     */
    public static final class Eviction {

        private final Availability previous;
        private final Instant lastActivity;
        private final String heldTaskId;

        private Eviction(Availability previous, Instant lastActivity, String heldTaskId) {
            this.previous = previous;
            this.lastActivity = lastActivity;
            this.heldTaskId = heldTaskId;
        }

        public Availability getPrevious() {
            return previous;
        }

        public Instant getLastActivity() {
            return lastActivity;
        }

        public Optional<String> getHeldTaskId() {
            return Optional.ofNullable(heldTaskId);
        }
    }

    @Override
    public String toString() {
        return "WorkerRegistration{" +
                "workerId='" + workerId + '\'' +
                ", type='" + getWorkerType() + '\'' +
                ", availability=" + getAvailability() +
                '}';
    }
}
