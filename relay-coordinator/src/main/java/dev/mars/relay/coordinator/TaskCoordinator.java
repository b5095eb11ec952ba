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

package dev.mars.relay.coordinator;

import dev.mars.relay.coordinator.config.CoordinatorConfig;
import dev.mars.relay.coordinator.event.CoordinatorEvent;
import dev.mars.relay.coordinator.event.CoordinatorEventListener;
import dev.mars.relay.coordinator.event.EventPublisher;
import dev.mars.relay.coordinator.handoff.ContextSerializer;
import dev.mars.relay.coordinator.handoff.HandoffCondition;
import dev.mars.relay.coordinator.handoff.HandoffConditionRegistry;
import dev.mars.relay.coordinator.handoff.HandoffRuleEngine;
import dev.mars.relay.coordinator.handoff.HandoffService;
import dev.mars.relay.coordinator.handoff.HandoffStats;
import dev.mars.relay.coordinator.health.HealthMonitorService;
import dev.mars.relay.coordinator.observability.CoordinatorMetrics;
import dev.mars.relay.coordinator.service.TaskSchedulerService;
import dev.mars.relay.coordinator.service.WorkerRegistry;
import dev.mars.relay.coordinator.service.WorkerSelectionService;
import dev.mars.relay.core.HandoffEvent;
import dev.mars.relay.core.HandoffRequest;
import dev.mars.relay.core.HandoffRule;
import dev.mars.relay.core.QueueStatus;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.TaskPriority;
import dev.mars.relay.core.TaskRecord;
import dev.mars.relay.core.TaskSnapshot;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.core.exceptions.InvalidHandoffRuleException;
import dev.mars.relay.core.exceptions.WorkerNotFoundException;
import dev.mars.relay.worker.Availability;
import dev.mars.relay.worker.Worker;
import dev.mars.relay.worker.WorkerRegistration;
import dev.mars.relay.worker.WorkerSignals;
import dev.mars.relay.worker.WorkerSnapshot;
import dev.mars.relay.worker.WorkerState;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the coordination engine.
 *
 * <p>Wires the worker registry, the scheduler, the handoff subsystem and the health
 * monitor onto a {@link Vertx} instance owned by the caller. Nothing runs until
 * {@link #start()} is called; {@link #stop()} cancels the timers and leaves tasks and
 * registrations in place.</p>
 *
 * <pre>{@code
 * TaskCoordinator coordinator = new TaskCoordinator(vertx);
 * coordinator.registerWorker(codingWorker);
 * coordinator.start();
 * String taskId = coordinator.submitTask(Set.of("java"), TaskContext.of("Add a retry"), TaskPriority.HIGH);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class TaskCoordinator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TaskCoordinator.class);

    static final String UNREGISTERED_REASON = "worker unregistered";

    private final CoordinatorConfig config;
    private final EventPublisher events;
    private final WorkerRegistry registry;
    private final CoordinatorMetrics metrics;
    private final TaskSchedulerService scheduler;
    private final HandoffRuleEngine ruleEngine;
    private final HandoffService handoffService;
    private final HealthMonitorService healthMonitor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TaskCoordinator(Vertx vertx) {
        this(vertx, new CoordinatorConfig());
    }

    public TaskCoordinator(Vertx vertx, CoordinatorConfig config) {
        this(vertx, config, GlobalOpenTelemetry.get());
    }

    public TaskCoordinator(Vertx vertx, CoordinatorConfig config, OpenTelemetry openTelemetry) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");

        this.events = new EventPublisher();
        this.registry = new WorkerRegistry(events);
        this.metrics = new CoordinatorMetrics(openTelemetry, registry::countAvailable);
        WorkerSelectionService selectionService = new WorkerSelectionService(config.getSelectionWeights());
        this.scheduler = new TaskSchedulerService(vertx, registry, selectionService, events, metrics, config);

        this.ruleEngine = new HandoffRuleEngine(HandoffConditionRegistry.withDefaults());
        if (config.isDefaultRulesEnabled()) {
            ruleEngine.installDefaultRules();
        }
        this.handoffService = new HandoffService(registry, selectionService, scheduler, ruleEngine,
                new ContextSerializer(), events, config);
        scheduler.setAssignmentRouter(handoffService);

        this.healthMonitor = new HealthMonitorService(vertx, registry, scheduler, events, config);
    }

    // ==================== Lifecycle ====================

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Coordinator already running");
            return;
        }
        config.logConfiguration();
        scheduler.start();
        healthMonitor.start();
        logger.info("Task coordinator started with {} worker(s) and {} handoff rule(s)",
                registry.size(), ruleEngine.getRules().size());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        healthMonitor.stop();
        scheduler.stop();
        logger.info("Task coordinator stopped ({} task(s) still queued)", scheduler.getQueueDepth());
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        metrics.close();
    }

    // ==================== Workers ====================

    /**
     * Register a worker, or refresh the registration of a worker already known by
     * its id. The worker receives its signal handle through {@link Worker#bind(WorkerSignals)}.
     *
     * @return the state of the registration
     */
    public WorkerSnapshot registerWorker(Worker worker) {
        WorkerRegistration registration = registry.register(worker);
        worker.bind(new BoundSignals(registration.getWorkerId()));
        return registration.snapshot();
    }

    /**
     * Remove a worker. A task it was executing goes back to the front of the queue.
     *
     * @throws WorkerNotFoundException if no worker has this id
     */
    public void unregisterWorker(String workerId) throws WorkerNotFoundException {
        Set<String> held = new LinkedHashSet<>();
        registry.unregister(workerId).ifPresent(held::add);
        held.addAll(scheduler.getTasksAssignedTo(workerId));

        String requeued = null;
        for (String taskId : held) {
            if (scheduler.requeueIfAssigned(taskId, workerId, UNREGISTERED_REASON) && requeued == null) {
                requeued = taskId;
            }
        }
        events.publish(new CoordinatorEvent.WorkerUnregistered(workerId, requeued, Instant.now()));
    }

    /**
     * @return true if the availability changed
     * @throws WorkerNotFoundException if no worker has this id
     */
    public boolean updateWorkerAvailability(String workerId, Availability availability)
            throws WorkerNotFoundException {
        return registry.updateAvailability(workerId, availability);
    }

    /**
     * Every registered worker, in registration order.
     */
    public List<WorkerSnapshot> getWorkerStatus() {
        return registry.snapshots();
    }

    public Optional<WorkerSnapshot> getWorkerStatus(String workerId) {
        return registry.get(workerId).map(WorkerRegistration::snapshot);
    }

    // ==================== Tasks ====================

    public String submitTask(Collection<String> requiredCapabilities, TaskContext context) {
        return submitTask(requiredCapabilities, context, TaskPriority.MEDIUM, null);
    }

    public String submitTask(Collection<String> requiredCapabilities, TaskContext context, TaskPriority priority) {
        return submitTask(requiredCapabilities, context, priority, null);
    }

    /**
     * Queue a task. It is picked up by the next assignment tick.
     *
     * @param requiredCapabilities what the task needs; empty matches any worker
     * @param context the payload the worker receives
     * @param priority queue priority
     * @param deadline optional deadline, used only to order the queue
     * @return the task id
     */
    public String submitTask(Collection<String> requiredCapabilities, TaskContext context,
                             TaskPriority priority, Instant deadline) {
        String taskId = scheduler.submit(requiredCapabilities, context, priority, deadline);
        scheduler.triggerAssignment();
        return taskId;
    }

    public Optional<TaskSnapshot> getTaskStatus(String taskId) {
        return scheduler.getTask(taskId).map(TaskRecord::snapshot);
    }

    public QueueStatus getQueueStatus() {
        return scheduler.getQueueStatus();
    }

    /**
     * Forget finished tasks.
     *
     * @return the number of tasks removed
     */
    public int purgeTerminalTasks() {
        return scheduler.purgeTerminalTasks();
    }

    // ==================== Handoffs ====================

    /**
     * Run the handoff rules against a task in progress and move it if one fires.
     */
    public Optional<HandoffEvent> evaluateHandoff(String taskId, WorkerResult partialResult) {
        return handoffService.evaluateHandoff(taskId, partialResult);
    }

    /**
     * Act on a handoff request as if the requesting worker had signalled it.
     */
    public Optional<HandoffEvent> requestHandoff(HandoffRequest request) {
        return handoffService.handleRequest(request);
    }

    /**
     * @throws InvalidHandoffRuleException if the rule's patterns or triggers are invalid
     */
    public void addHandoffRule(HandoffRule rule) throws InvalidHandoffRuleException {
        ruleEngine.addRule(rule);
    }

    public boolean removeHandoffRule(String ruleId) {
        return ruleEngine.removeRule(ruleId);
    }

    public boolean setHandoffRuleEnabled(String ruleId, boolean enabled) {
        return ruleEngine.setRuleEnabled(ruleId, enabled);
    }

    public List<HandoffRule> getHandoffRules() {
        return ruleEngine.getRules();
    }

    /**
     * Add or replace a named condition that rule triggers can refer to.
     */
    public void registerHandoffCondition(HandoffCondition condition) {
        ruleEngine.getConditions().register(condition);
    }

    public HandoffStats getHandoffStats() {
        return handoffService.getHandoffStats();
    }

    // ==================== Events ====================

    public void addListener(CoordinatorEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(CoordinatorEventListener listener) {
        events.removeListener(listener);
    }

    // ==================== Internals exposed for embedding ====================

    public CoordinatorConfig getConfig() {
        return config;
    }

    public TaskSchedulerService getScheduler() {
        return scheduler;
    }

    public HealthMonitorService getHealthMonitor() {
        return healthMonitor;
    }

    private final class BoundSignals implements WorkerSignals {

        private final String workerId;

        private BoundSignals(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public void statusChanged(WorkerState state) {
            if (state != null) {
                registry.applySignal(workerId, state);
            }
        }

        @Override
        public void requestHandoff(HandoffRequest request) {
            if (request == null) {
                return;
            }
            if (!workerId.equals(request.getFromWorkerId())) {
                logger.warn("Worker {} sent a handoff request on behalf of {}, ignoring", workerId,
                        request.getFromWorkerId());
                return;
            }
            try {
                handoffService.handleRequest(request);
            } catch (RuntimeException e) {
                logger.error("Handoff request from worker {} for task {} failed", workerId,
                        request.getTaskId(), e);
            }
        }
    }
}
