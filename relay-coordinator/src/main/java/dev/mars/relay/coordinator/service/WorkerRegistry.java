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

package dev.mars.relay.coordinator.service;

import dev.mars.relay.coordinator.event.CoordinatorEvent;
import dev.mars.relay.coordinator.event.EventPublisher;
import dev.mars.relay.core.exceptions.WorkerNotFoundException;
import dev.mars.relay.worker.Availability;
import dev.mars.relay.worker.Worker;
import dev.mars.relay.worker.WorkerPerformance;
import dev.mars.relay.worker.WorkerRegistration;
import dev.mars.relay.worker.WorkerSnapshot;
import dev.mars.relay.worker.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Table of registered workers.
 *
 * <p>The table itself is a {@link ConcurrentHashMap}; each entry guards its own
 * state, so updates for different workers never block each other. Listings are
 * returned in registration order, which is the order selection uses to break
 * ties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<String, WorkerRegistration> registrations = new ConcurrentHashMap<>();
    private final AtomicLong registrationCounter = new AtomicLong();
    private final EventPublisher events;

    public WorkerRegistry(EventPublisher events) {
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
    }

    /**
     * Register a worker. Registering an id that is already present refreshes the
     * entry's type and capabilities and keeps its state. A different instance under a
     * known id takes over the entry: it inherits availability, the held task and
     * performance, so a worker busy with a task stays busy with it.
     *
     * @param worker the worker to register
     * @return the single registration for this worker id
     */
    public WorkerRegistration register(Worker worker) {
        Objects.requireNonNull(worker, "Worker cannot be null");
        String workerId = Objects.requireNonNull(worker.getWorkerId(), "Worker id cannot be null");

        boolean[] created = new boolean[1];
        WorkerRegistration registration = registrations.compute(workerId, (id, existing) -> {
            if (existing != null && existing.getWorker() == worker) {
                existing.refresh();
                return existing;
            }
            created[0] = existing == null;
            if (existing == null) {
                return new WorkerRegistration(worker, registrationCounter.incrementAndGet());
            }
            WorkerRegistration successor = existing.replaceWith(worker);
            logger.warn("Worker {} registered again with a different instance, replacing entry ({}, task {})",
                    id, successor.getAvailability(), successor.getCurrentTaskId().orElse("none"));
            return successor;
        });

        if (created[0]) {
            logger.info("Worker registered: {} (type={}, capabilities={})",
                    workerId, registration.getWorkerType(), registration.getCapabilities());
        } else {
            logger.info("Worker re-registered: {} (capabilities={})", workerId, registration.getCapabilities());
        }
        events.publish(new CoordinatorEvent.WorkerRegistered(workerId, registration.getWorkerType(),
                registration.getCapabilities(), !created[0], Instant.now()));
        return registration;
    }

    /**
     * Remove a worker. The entry goes offline first, detaching any task it held.
     *
     * @param workerId the worker to remove
     * @return the task the worker was holding, if any
     * @throws WorkerNotFoundException if the worker is not registered
     */
    public Optional<String> unregister(String workerId) throws WorkerNotFoundException {
        WorkerRegistration registration = registrations.remove(workerId);
        if (registration == null) {
            throw new WorkerNotFoundException(workerId);
        }
        Availability previous = registration.getAvailability();
        Optional<String> heldTask = registration.goOffline();
        if (previous != Availability.OFFLINE) {
            events.publish(new CoordinatorEvent.WorkerAvailabilityChanged(workerId, previous,
                    Availability.OFFLINE, Instant.now()));
        }
        logger.info("Worker unregistered: {}{}", workerId,
                heldTask.map(taskId -> " (was holding task " + taskId + ")").orElse(""));
        return heldTask;
    }

    public Optional<WorkerRegistration> get(String workerId) {
        return workerId == null ? Optional.empty() : Optional.ofNullable(registrations.get(workerId));
    }

    public WorkerRegistration require(String workerId) throws WorkerNotFoundException {
        return get(workerId).orElseThrow(() -> new WorkerNotFoundException(workerId));
    }

    /**
     * Whether {@code registration} is still the live entry for its worker and still
     * holds {@code taskId}.
     */
    public boolean isHolding(WorkerRegistration registration, String taskId) {
        WorkerRegistration current = registrations.get(registration.getWorkerId());
        return current == registration
                && registration.getCurrentTaskId().map(held -> held.equals(taskId)).orElse(false);
    }

    public boolean isRegistered(String workerId) {
        return workerId != null && registrations.containsKey(workerId);
    }

    /**
     * All registrations, in registration order.
     */
    public List<WorkerRegistration> getRegistrations() {
        return registrations.values().stream()
                .sorted(Comparator.comparingLong(WorkerRegistration::getRegistrationOrder))
                .collect(Collectors.toList());
    }

    /**
     * Available registrations, in registration order.
     */
    public List<WorkerRegistration> getAvailable() {
        return getRegistrations().stream()
                .filter(WorkerRegistration::isAvailable)
                .collect(Collectors.toList());
    }

    public List<WorkerSnapshot> snapshots() {
        return getRegistrations().stream()
                .map(WorkerRegistration::snapshot)
                .collect(Collectors.toList());
    }

    public int size() {
        return registrations.size();
    }

    public long countAvailable() {
        return registrations.values().stream().filter(WorkerRegistration::isAvailable).count();
    }

    /**
     * Set a worker's availability from outside. Making a worker available while it
     * still holds a task is refused.
     *
     * @return true if the availability changed
     * @throws WorkerNotFoundException if the worker is not registered
     */
    public boolean updateAvailability(String workerId, Availability availability) throws WorkerNotFoundException {
        WorkerRegistration registration = require(workerId);
        Optional<Availability> previous = registration.changeAvailability(availability);
        if (previous.isEmpty()) {
            if (registration.getAvailability() != availability) {
                logger.warn("Refused availability change of worker {} to {} (holding task {})",
                        workerId, availability, registration.getCurrentTaskId().orElse("none"));
            }
            return false;
        }
        logger.info("Worker {} availability: {} -> {}", workerId, previous.get(), availability);
        events.publish(new CoordinatorEvent.WorkerAvailabilityChanged(workerId, previous.get(),
                availability, Instant.now()));
        return true;
    }

    /**
     * Interpret a status signal sent by a worker.
     *
     * <ul>
     *   <li>{@code IDLE} makes a worker that holds no task available, offline ones included.</li>
     *   <li>{@code BUSY} marks the worker busy.</li>
     *   <li>{@code FAILED} and {@code COMPLETED} only count as activity; task outcomes
     *       arrive through the execution result.</li>
     * </ul>
     */
    public void applySignal(String workerId, WorkerState state) {
        Optional<WorkerRegistration> found = get(workerId);
        if (found.isEmpty()) {
            logger.debug("Ignoring {} signal from unregistered worker {}", state, workerId);
            return;
        }
        WorkerRegistration registration = found.get();
        registration.touch();

        Availability target;
        switch (state) {
            case IDLE:
                target = Availability.AVAILABLE;
                break;
            case BUSY:
                target = Availability.BUSY;
                break;
            default:
                logger.debug("Worker {} reported {}", workerId, state);
                return;
        }
        Optional<Availability> previous = registration.changeAvailability(target);
        if (previous.isPresent()) {
            logger.info("Worker {} signalled {}: {} -> {}", workerId, state, previous.get(), target);
            events.publish(new CoordinatorEvent.WorkerAvailabilityChanged(workerId, previous.get(),
                    target, Instant.now()));
        }
    }

    /**
     * Fold a finished execution into a worker's running performance figures.
     * Unknown workers are ignored.
     */
    public Optional<WorkerPerformance> updatePerformance(String workerId, boolean success, long responseTimeMs) {
        return get(workerId).map(registration -> {
            WorkerPerformance updated = registration.recordExecution(success, responseTimeMs);
            logger.debug("Worker {} performance now {}", workerId, updated);
            return updated;
        });
    }
}
