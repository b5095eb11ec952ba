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

package dev.mars.relay.coordinator.health;

import dev.mars.relay.coordinator.config.CoordinatorConfig;
import dev.mars.relay.coordinator.event.CoordinatorEvent;
import dev.mars.relay.coordinator.event.EventPublisher;
import dev.mars.relay.coordinator.service.TaskSchedulerService;
import dev.mars.relay.coordinator.service.WorkerRegistry;
import dev.mars.relay.worker.Availability;
import dev.mars.relay.worker.WorkerRegistration;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep that takes silent workers offline.
 *
 * <p>A worker with no activity for longer than {@code relay.health.inactivity-threshold.ms}
 * that is not already offline goes {@link Availability#OFFLINE}, a
 * {@link CoordinatorEvent.WorkerUnresponsive} event is published and the task it
 * held is requeued at the front of the queue. The registration is kept, so the
 * worker's next idle signal brings it back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HealthMonitorService {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitorService.class);

    static final String UNRESPONSIVE_REASON = "worker unresponsive";

    private final Vertx vertx;
    private final WorkerRegistry registry;
    private final TaskSchedulerService scheduler;
    private final EventPublisher events;
    private final long intervalMs;
    private final Duration inactivityThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile long timerId;

    public HealthMonitorService(Vertx vertx, WorkerRegistry registry, TaskSchedulerService scheduler,
                                EventPublisher events, CoordinatorConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.registry = Objects.requireNonNull(registry, "Worker registry cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.intervalMs = config.getHealthIntervalMs();
        this.inactivityThreshold = Duration.ofMillis(config.getInactivityThresholdMs());
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        timerId = vertx.setPeriodic(intervalMs, id -> {
            if (running.get()) {
                try {
                    runSweep();
                } catch (Exception e) {
                    logger.error("Error in health sweep", e);
                }
            }
        });
        logger.info("Health monitor started (interval: {}ms, inactivity threshold: {}ms) [Vert.x timer ID: {}]",
                intervalMs, inactivityThreshold.toMillis(), timerId);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        boolean cancelled = vertx.cancelTimer(timerId);
        logger.info("Health monitor stopped, timer cancelled: {} [ID: {}]", cancelled, timerId);
        timerId = 0;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Sweep now.
     *
     * @return ids of the workers taken offline
     */
    public List<String> runSweep() {
        return runSweep(Instant.now());
    }

    /**
     * Sweep as if the current time were {@code now}.
     *
     * @return ids of the workers taken offline
     */
    public List<String> runSweep(Instant now) {
        Instant cutoff = now.minus(inactivityThreshold);
        List<String> offline = new ArrayList<>();
        for (WorkerRegistration registration : registry.getRegistrations()) {
            try {
                Optional<WorkerRegistration.Eviction> eviction = registration.goOfflineIfInactiveSince(cutoff);
                if (eviction.isPresent()) {
                    markUnresponsive(registration.getWorkerId(), eviction.get());
                    offline.add(registration.getWorkerId());
                }
            } catch (RuntimeException e) {
                logger.error("Error taking worker {} offline", registration.getWorkerId(), e);
            }
        }
        if (!offline.isEmpty()) {
            logger.info("Health sweep took {} worker(s) offline: {}", offline.size(), offline);
        } else {
            logger.debug("Health sweep found no unresponsive workers");
        }
        return offline;
    }

    private void markUnresponsive(String workerId, WorkerRegistration.Eviction eviction) {
        Availability previous = eviction.getPrevious();
        Instant lastActivity = eviction.getLastActivity();
        Optional<String> heldTask = eviction.getHeldTaskId();

        logger.warn("Worker {} unresponsive since {}, marking offline", workerId, lastActivity);
        events.publish(new CoordinatorEvent.WorkerAvailabilityChanged(workerId, previous,
                Availability.OFFLINE, Instant.now()));
        events.publish(new CoordinatorEvent.WorkerUnresponsive(workerId, lastActivity, Instant.now()));
        heldTask.ifPresent(taskId -> scheduler.requeueIfAssigned(taskId, workerId, UNRESPONSIVE_REASON));
    }
}
