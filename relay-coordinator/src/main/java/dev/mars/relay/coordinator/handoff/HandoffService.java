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

package dev.mars.relay.coordinator.handoff;

import dev.mars.relay.coordinator.config.CoordinatorConfig;
import dev.mars.relay.coordinator.event.CoordinatorEvent;
import dev.mars.relay.coordinator.event.EventPublisher;
import dev.mars.relay.coordinator.service.AssignmentRouter;
import dev.mars.relay.coordinator.service.TaskSchedulerService;
import dev.mars.relay.coordinator.service.WorkerRegistry;
import dev.mars.relay.coordinator.service.WorkerSelectionService;
import dev.mars.relay.core.HandoffEvent;
import dev.mars.relay.core.HandoffReason;
import dev.mars.relay.core.HandoffRequest;
import dev.mars.relay.core.HandoffSeverity;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.TaskRecord;
import dev.mars.relay.core.TaskStatus;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.core.exceptions.InvalidTransitionException;
import dev.mars.relay.worker.Availability;
import dev.mars.relay.worker.WorkerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Moves tasks between workers.
 *
 * <p>Three paths lead here:</p>
 * <ul>
 *   <li>a worker raises a {@link HandoffRequest} for the task it holds;</li>
 *   <li>{@link #evaluateHandoff(String, WorkerResult)} runs the rules for a task in progress;</li>
 *   <li>the assignment loop asks {@link #route(TaskRecord, WorkerRegistration)} before committing.</li>
 * </ul>
 *
 * <p>A transfer reserves the receiving worker first, records an unsettled
 * {@link HandoffEvent}, releases the previous worker and re-dispatches the task with
 * a context trimmed to the last {@code relay.handoff.history-window} conversation
 * entries. The event settles when the re-dispatched execution finishes. When no
 * worker can take the task it stays where it is.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class HandoffService implements AssignmentRouter {

    private static final Logger logger = LoggerFactory.getLogger(HandoffService.class);

    private final WorkerRegistry registry;
    private final WorkerSelectionService selectionService;
    private final TaskSchedulerService scheduler;
    private final HandoffRuleEngine ruleEngine;
    private final ContextSerializer contextSerializer;
    private final EventPublisher events;
    private final int historyWindow;

    public HandoffService(WorkerRegistry registry, WorkerSelectionService selectionService,
                          TaskSchedulerService scheduler, HandoffRuleEngine ruleEngine,
                          ContextSerializer contextSerializer, EventPublisher events, CoordinatorConfig config) {
        this.registry = Objects.requireNonNull(registry, "Worker registry cannot be null");
        this.selectionService = Objects.requireNonNull(selectionService, "Selection service cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "Rule engine cannot be null");
        this.contextSerializer = contextSerializer != null ? contextSerializer : new ContextSerializer();
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.historyWindow = config.getHandoffHistoryWindow();
    }

    public HandoffRuleEngine getRuleEngine() {
        return ruleEngine;
    }

    // ==================== Pre-commit routing ====================

    @Override
    public Optional<Route> route(TaskRecord task, WorkerRegistration selected) {
        Optional<HandoffDecision> decision = ruleEngine.evaluate(task.getContext(), selected.getWorkerType(), null);
        if (decision.isEmpty()) {
            return Optional.empty();
        }
        HandoffDecision d = decision.get();
        Optional<WorkerRegistration> target = findTarget(d, task.getRequiredCapabilities(),
                Set.of(selected.getWorkerId()));
        if (target.isEmpty()) {
            logger.warn("No available worker matches {} for task {}, keeping worker {}",
                    d.getTargetPattern().pattern(), task.getTaskId(), selected.getWorkerId());
            return Optional.empty();
        }
        TaskContext context = task.getContext().forHandoff(selected.getWorkerId(), d.getReason(), historyWindow);
        return Optional.of(new Route(target.get(), d.getReason(), context, contextSerializer.sizeOf(context)));
    }

    // ==================== Explicit requests ====================

    /**
     * Handle a request from the worker that holds a task. The new worker is chosen
     * among available workers covering at least one requested capability; the
     * requester is never chosen.
     *
     * @param request the worker's request
     * @return the recorded handoff, or empty if the task stayed where it was
     */
    public Optional<HandoffEvent> handleRequest(HandoffRequest request) {
        Objects.requireNonNull(request, "Handoff request cannot be null");
        logger.info("Handoff request received: task {} from {} ({})", request.getTaskId(),
                request.getFromWorkerId(), request.getReason().getType().getValue());

        Optional<TaskRecord> held = heldTask(request.getTaskId(), request.getFromWorkerId());
        if (held.isEmpty()) {
            return Optional.empty();
        }
        TaskRecord task = held.get();

        Set<String> required = request.getRequiredCapabilities().isEmpty()
                ? task.getRequiredCapabilities() : request.getRequiredCapabilities();
        List<WorkerRegistration> candidates = registry.getRegistrations().stream()
                .filter(r -> selectionService.capabilityScore(required, r.getCapabilities()) > 0.0)
                .collect(Collectors.toList());
        Optional<WorkerRegistration> target = selectionService.selectWorker(required, candidates,
                Set.of(request.getFromWorkerId()));
        if (target.isEmpty()) {
            logger.warn("No suitable worker found for handoff of task {} (capabilities={})",
                    task.getTaskId(), required);
            return Optional.empty();
        }

        HandoffReason reason = request.getReason();
        HandoffSeverity urgencySeverity = request.getUrgency().toSeverity();
        if (urgencySeverity.compareTo(reason.getSeverity()) > 0) {
            reason = new HandoffReason(reason.getType(), reason.getDescription(), urgencySeverity);
        }
        return executeHandoff(task, request.getFromWorkerId(), target.get(), reason);
    }

    // ==================== Rule evaluation ====================

    /**
     * Run the handoff rules for a task in progress and transfer it if one fires.
     *
     * @param taskId the task
     * @param partialResult what the current worker has produced so far, may be null
     * @return the recorded handoff, or empty if the task stayed where it was
     */
    public Optional<HandoffEvent> evaluateHandoff(String taskId, WorkerResult partialResult) {
        Optional<TaskRecord> found = scheduler.getTask(taskId);
        if (found.isEmpty()) {
            logger.warn("Handoff evaluation for unknown task {}", taskId);
            return Optional.empty();
        }
        TaskRecord task = found.get();
        if (task.getStatus() != TaskStatus.IN_PROGRESS) {
            logger.debug("Task {} is {}, nothing to hand off", taskId, task.getStatus());
            return Optional.empty();
        }
        Optional<WorkerRegistration> current = task.getAssignedWorker().flatMap(registry::get);
        if (current.isEmpty()) {
            logger.debug("Task {} has no registered worker, nothing to hand off", taskId);
            return Optional.empty();
        }

        WorkerRegistration from = current.get();
        Optional<HandoffDecision> decision = ruleEngine.evaluate(task.getContext(), from.getWorkerType(), partialResult);
        if (decision.isEmpty()) {
            return Optional.empty();
        }
        HandoffDecision d = decision.get();
        Optional<WorkerRegistration> target = findTarget(d, task.getRequiredCapabilities(), Set.of(from.getWorkerId()));
        if (target.isEmpty()) {
            logger.warn("Handoff of task {} to {} wanted ({}), but no worker of that type is available",
                    taskId, d.getTargetPattern().pattern(), d.getReason().getDescription());
            return Optional.empty();
        }
        return executeHandoff(task, from.getWorkerId(), target.get(), d.getReason());
    }

    /**
     * Figures over every handoff recorded on the tasks the scheduler still holds.
     */
    public HandoffStats getHandoffStats() {
        return HandoffStats.of(scheduler.getTasks().stream()
                .flatMap(task -> task.getHandoffHistory().stream())
                .collect(Collectors.toList()));
    }

    // ==================== Transfer ====================

    private Optional<HandoffEvent> executeHandoff(TaskRecord task, String fromWorkerId,
                                                  WorkerRegistration target, HandoffReason reason) {
        String taskId = task.getTaskId();
        if (!target.tryReserve(taskId)) {
            logger.warn("Worker {} was taken before task {} could be handed to it", target.getWorkerId(), taskId);
            return Optional.empty();
        }
        events.publish(new CoordinatorEvent.WorkerAvailabilityChanged(target.getWorkerId(),
                Availability.AVAILABLE, Availability.BUSY, Instant.now()));
        if (!registry.isHolding(target, taskId)) {
            logger.warn("Worker {} was lost before task {} could be handed to it", target.getWorkerId(), taskId);
            scheduler.abandonReservation(target, taskId);
            return Optional.empty();
        }

        TaskContext context = task.getContext().forHandoff(fromWorkerId, reason, historyWindow);
        HandoffEvent event = HandoffEvent.pending(taskId, fromWorkerId, target.getWorkerId(), reason,
                contextSerializer.sizeOf(context));

        long sequence;
        try {
            sequence = task.handOff(event, context);
        } catch (InvalidTransitionException e) {
            logger.warn("Handoff of task {} abandoned: {}", taskId, e.getMessage());
            scheduler.releaseWorker(target, taskId);
            return Optional.empty();
        }

        registry.get(fromWorkerId).ifPresent(previous -> scheduler.releaseWorker(previous, taskId));
        if (!registry.isHolding(target, taskId)) {
            logger.warn("Worker {} was lost while task {} was being handed to it", target.getWorkerId(), taskId);
            scheduler.requeue(taskId, TaskSchedulerService.LOST_WORKER_REASON);
            return Optional.empty();
        }
        logger.info("Task {} handed off from {} to {}: {}", taskId, fromWorkerId, target.getWorkerId(),
                reason.getDescription());
        events.publish(new CoordinatorEvent.TaskHandoff(taskId, event, Instant.now()));
        events.publish(new CoordinatorEvent.TaskAssigned(taskId, target.getWorkerId(), Instant.now()));
        scheduler.dispatch(task, target, sequence);
        return Optional.of(event);
    }

    private Optional<TaskRecord> heldTask(String taskId, String workerId) {
        Optional<TaskRecord> found = scheduler.getTask(taskId);
        if (found.isEmpty()) {
            logger.warn("Handoff request for unknown task {}", taskId);
            return Optional.empty();
        }
        TaskRecord task = found.get();
        if (task.getStatus() != TaskStatus.IN_PROGRESS
                || !task.getAssignedWorker().map(workerId::equals).orElse(false)) {
            logger.warn("Ignoring handoff request for task {} from {}: task is {} on {}", taskId, workerId,
                    task.getStatus(), task.getAssignedWorker().orElse("no worker"));
            return Optional.empty();
        }
        return found;
    }

    private Optional<WorkerRegistration> findTarget(HandoffDecision decision, Set<String> requiredCapabilities,
                                                    Set<String> excluded) {
        List<WorkerRegistration> candidates = registry.getRegistrations().stream()
                .filter(r -> decision.matchesTarget(r.getWorkerType()))
                .collect(Collectors.toList());
        return selectionService.selectWorker(requiredCapabilities, candidates, excluded);
    }
}
