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

import dev.mars.relay.coordinator.config.CoordinatorConfig;
import dev.mars.relay.coordinator.event.CoordinatorEvent;
import dev.mars.relay.coordinator.event.CoordinatorEventListener;
import dev.mars.relay.coordinator.event.EventPublisher;
import dev.mars.relay.coordinator.observability.CoordinatorMetrics;
import dev.mars.relay.core.HandoffEvent;
import dev.mars.relay.core.QueueStatus;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.TaskPriority;
import dev.mars.relay.core.TaskRecord;
import dev.mars.relay.core.TaskStatus;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.core.exceptions.InvalidTransitionException;
import dev.mars.relay.worker.Availability;
import dev.mars.relay.worker.WorkerRegistration;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Owns the tasks of a coordinator and moves them from the queue to workers.
 *
 * <h3>Assignment loop:</h3>
 * <p>A Vert.x periodic timer runs {@link #runAssignmentTick()}. Each tick walks the
 * queue in order. For every task it selects a worker, lets the
 * {@link AssignmentRouter} redirect the choice, reserves the worker with a
 * compare-and-set and only then moves the task to {@code IN_PROGRESS}. A task no
 * worker can take keeps its place and the tick moves on; the tick ends early once
 * no worker is available. Ticks never wait on a worker: execution results arrive
 * through the returned {@link Future}.</p>
 *
 * <h3>Completion:</h3>
 * <p>Results are recorded against the dispatch they belong to. A result from a
 * dispatch that a handoff or requeue superseded is dropped. On an accepted result
 * the worker's performance is updated, the task becomes {@code COMPLETED} or
 * {@code FAILED}, the worker is released and the retry policy runs.</p>
 *
 * <h3>Retry policy:</h3>
 * <p>A failed task goes back to the front of the queue only if it has fewer
 * handoffs than {@code relay.retry.max-handoffs}, its priority is not
 * {@link TaskPriority#LOW}, and {@code relay.scheduler.max-retries} (when non-zero)
 * has not been reached.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class TaskSchedulerService {

    private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerService.class);

    public static final String LOST_WORKER_REASON = "worker lost during commit";

    private final Vertx vertx;
    private final WorkerRegistry registry;
    private final WorkerSelectionService selectionService;
    private final EventPublisher events;
    private final CoordinatorMetrics metrics;

    private final long intervalMs;
    private final int maxRetries;
    private final int maxHandoffsForRetry;

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final TaskQueue queue = new TaskQueue();
    private final AtomicLong submissionCounter = new AtomicLong();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CoordinatorEventListener wakeUpListener = this::onCoordinatorEvent;

    private volatile AssignmentRouter router = AssignmentRouter.DIRECT;
    private volatile long timerId;

    public TaskSchedulerService(Vertx vertx, WorkerRegistry registry, WorkerSelectionService selectionService,
                                EventPublisher events, CoordinatorMetrics metrics, CoordinatorConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.registry = Objects.requireNonNull(registry, "Worker registry cannot be null");
        this.selectionService = Objects.requireNonNull(selectionService, "Selection service cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.intervalMs = config.getSchedulerIntervalMs();
        this.maxRetries = config.getMaxRetries();
        this.maxHandoffsForRetry = config.getMaxHandoffsForRetry();
    }

    public void setAssignmentRouter(AssignmentRouter router) {
        this.router = router != null ? router : AssignmentRouter.DIRECT;
    }

    // ==================== Lifecycle ====================

    /**
     * Start the periodic assignment loop. Also wakes the loop whenever a worker
     * registers or becomes available.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Task scheduler already running");
            return;
        }
        events.addListener(wakeUpListener);
        timerId = vertx.setPeriodic(intervalMs, id -> {
            if (running.get()) {
                runAssignmentTickSafely();
            }
        });
        logger.info("Task scheduler started (interval: {}ms) [Vert.x timer ID: {}]", intervalMs, timerId);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        boolean cancelled = vertx.cancelTimer(timerId);
        events.removeListener(wakeUpListener);
        logger.info("Task scheduler stopped, timer cancelled: {} [ID: {}]", cancelled, timerId);
        timerId = 0;
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Submission ====================

    /**
     * Accept a task and put it on the queue.
     *
     * @param requiredCapabilities capabilities the task needs, possibly empty
     * @param context payload handed to the worker
     * @param priority queue priority, {@link TaskPriority#MEDIUM} if null
     * @param deadline optional deadline, used for ordering only
     * @return the new task id
     */
    public String submit(Collection<String> requiredCapabilities, TaskContext context,
                         TaskPriority priority, Instant deadline) {
        Objects.requireNonNull(requiredCapabilities, "Required capabilities cannot be null");
        TaskPriority effectivePriority = priority != null ? priority : TaskPriority.MEDIUM;

        TaskRecord task = new TaskRecord.Builder()
                .taskId("task-" + UUID.randomUUID())
                .requiredCapabilities(requiredCapabilities)
                .priority(effectivePriority)
                .deadline(deadline)
                .context(context)
                .submissionSequence(submissionCounter.incrementAndGet())
                .build();

        tasks.put(task.getTaskId(), task);
        queue.enqueue(task);
        metrics.recordSubmitted(effectivePriority);

        logger.info("Task submitted: {} (priority={}, capabilities={}{})", task.getTaskId(),
                effectivePriority.getValue(), task.getRequiredCapabilities(),
                deadline != null ? ", deadline=" + deadline : "");
        events.publish(new CoordinatorEvent.TaskSubmitted(task.getTaskId(), effectivePriority,
                task.getRequiredCapabilities(), Instant.now()));
        return task.getTaskId();
    }

    // ==================== Assignment ====================

    /**
     * Ask for a tick outside the timer. Does nothing while the scheduler is stopped.
     */
    public void triggerAssignment() {
        if (running.get()) {
            vertx.runOnContext(v -> runAssignmentTickSafely());
        }
    }

    /**
     * Run one pass over the queue.
     *
     * @return the number of tasks committed to a worker
     */
    public int runAssignmentTick() {
        tickLock.lock();
        try {
            List<TaskRecord> queued = queue.inOrder();
            if (queued.isEmpty()) {
                return 0;
            }
            int assigned = 0;
            for (TaskRecord task : queued) {
                if (registry.countAvailable() == 0) {
                    logger.debug("No available workers, {} task(s) left waiting", queue.size());
                    break;
                }
                try {
                    if (tryAssign(task)) {
                        assigned++;
                    }
                } catch (RuntimeException e) {
                    logger.error("Unexpected error assigning task {}", task.getTaskId(), e);
                }
            }
            logger.debug("Assignment tick committed {} task(s), {} still queued", assigned, queue.size());
            return assigned;
        } finally {
            tickLock.unlock();
        }
    }

    private void runAssignmentTickSafely() {
        try {
            runAssignmentTick();
        } catch (RuntimeException e) {
            logger.error("Error in assignment loop", e);
        }
    }

    private boolean tryAssign(TaskRecord task) {
        String taskId = task.getTaskId();
        if (task.getStatus() != TaskStatus.PENDING) {
            logger.debug("Dropping non-pending task {} from the queue", taskId);
            queue.remove(taskId);
            return false;
        }

        Optional<WorkerRegistration> selected = selectionService.selectWorker(
                task.getRequiredCapabilities(), registry.getRegistrations());
        if (selected.isEmpty()) {
            logger.debug("No eligible worker for task {} (capabilities={})", taskId, task.getRequiredCapabilities());
            return false;
        }

        WorkerRegistration chosen = selected.get();
        HandoffEvent routing = null;
        TaskContext routedContext = null;

        Optional<AssignmentRouter.Route> route = routeSafely(task, chosen);
        if (route.isPresent() && route.get().getTarget().tryReserve(taskId)) {
            AssignmentRouter.Route r = route.get();
            routing = HandoffEvent.pending(taskId, chosen.getWorkerId(), r.getTarget().getWorkerId(),
                    r.getReason(), r.getContextSizeBytes());
            routedContext = r.getContext();
            logger.info("Task {} routed from {} to {}: {}", taskId, chosen.getWorkerId(),
                    r.getTarget().getWorkerId(), r.getReason().getDescription());
            chosen = r.getTarget();
        } else if (!chosen.tryReserve(taskId)) {
            logger.debug("Worker {} was taken before task {} could be committed", chosen.getWorkerId(), taskId);
            return false;
        }
        publishAvailability(chosen.getWorkerId(), Availability.AVAILABLE, Availability.BUSY);

        if (!registry.isHolding(chosen, taskId)) {
            logger.warn("Worker {} was lost before task {} could be committed", chosen.getWorkerId(), taskId);
            abandonReservation(chosen, taskId);
            return false;
        }

        if (!queue.remove(taskId)) {
            releaseWorker(chosen, taskId);
            return false;
        }

        try {
            task.assign(chosen.getWorkerId(), routing, routedContext);
        } catch (InvalidTransitionException e) {
            logger.warn("Could not commit task {}: {}", taskId, e.getMessage());
            releaseWorker(chosen, taskId);
            return false;
        }

        long sequence;
        try {
            sequence = task.beginExecution();
        } catch (InvalidTransitionException e) {
            logger.warn("Task {} changed state while being committed: {}", taskId, e.getMessage());
            releaseWorker(chosen, taskId);
            return false;
        }

        if (!registry.isHolding(chosen, taskId)) {
            logger.warn("Worker {} was lost while task {} was being committed", chosen.getWorkerId(), taskId);
            requeue(taskId, LOST_WORKER_REASON);
            return false;
        }

        logger.info("Task {} assigned to worker {}", taskId, chosen.getWorkerId());
        if (routing != null) {
            events.publish(new CoordinatorEvent.TaskHandoff(taskId, routing, Instant.now()));
        }
        events.publish(new CoordinatorEvent.TaskAssigned(taskId, chosen.getWorkerId(), Instant.now()));
        dispatch(task, chosen, sequence);
        return true;
    }

    /**
     * Undo a reservation for a task that was never committed. The live entry is
     * released too when it replaced the reserved one and inherited the task.
     */
    public void abandonReservation(WorkerRegistration registration, String taskId) {
        releaseWorker(registration, taskId);
        registry.get(registration.getWorkerId())
                .filter(current -> current != registration)
                .ifPresent(current -> releaseWorker(current, taskId));
    }

    private Optional<AssignmentRouter.Route> routeSafely(TaskRecord task, WorkerRegistration selected) {
        try {
            Optional<AssignmentRouter.Route> route = router.route(task, selected);
            return route != null ? route : Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Routing failed for task {}, keeping worker {}", task.getTaskId(), selected.getWorkerId(), e);
            return Optional.empty();
        }
    }

    // ==================== Dispatch and completion ====================

    /**
     * Start an execution of {@code task} on {@code registration}. Never blocks; the
     * outcome is recorded when the worker's future settles.
     *
     * @param task the task, already {@code IN_PROGRESS} on this worker
     * @param registration the worker reserved for it
     * @param sequence the dispatch sequence the execution is stamped with
     */
    public void dispatch(TaskRecord task, WorkerRegistration registration, long sequence) {
        String workerId = registration.getWorkerId();
        Future<WorkerResult> execution;
        try {
            execution = registration.getWorker().execute(task.getContext());
            if (execution == null) {
                execution = Future.failedFuture(new IllegalStateException("Worker returned no future"));
            }
        } catch (RuntimeException e) {
            logger.warn("Worker {} threw while starting task {}", workerId, task.getTaskId(), e);
            execution = Future.failedFuture(e);
        }

        execution.onComplete(ar -> {
            WorkerResult result;
            if (ar.failed()) {
                result = WorkerResult.fromThrowable(workerId, ar.cause());
            } else if (ar.result() == null) {
                result = WorkerResult.failure(workerId, "Worker completed without a result");
            } else {
                result = ar.result();
            }
            try {
                handleCompletion(task, workerId, sequence, result);
            } catch (RuntimeException e) {
                logger.error("Error recording completion of task {} from worker {}", task.getTaskId(), workerId, e);
            }
        });
    }

    private void handleCompletion(TaskRecord task, String workerId, long sequence, WorkerResult result) {
        String taskId = task.getTaskId();
        TaskRecord.Settlement settlement = task.complete(sequence, result);
        if (!settlement.isAccepted()) {
            logger.debug("Ignoring result for task {} from worker {}: dispatch {} was superseded",
                    taskId, workerId, sequence);
            return;
        }

        Instant dispatchedAt = settlement.getDispatchedAt() != null ? settlement.getDispatchedAt() : Instant.now();
        long durationMs = Math.max(0L, Duration.between(dispatchedAt, Instant.now()).toMillis());
        registry.updatePerformance(workerId, result.isSuccess(), durationMs);
        registry.get(workerId).ifPresent(registration -> releaseWorker(registration, taskId));

        settlement.getSettledHandoff().ifPresent(handoff -> {
            metrics.recordHandoff(handoff.isSuccess());
            logger.info("Handoff of task {} from {} to {} settled: success={} ({}ms)", taskId,
                    handoff.getFromWorker(), handoff.getToWorker(), handoff.isSuccess(), handoff.getDurationMs());
            events.publish(new CoordinatorEvent.TaskHandoff(taskId, handoff, Instant.now()));
        });

        if (result.isSuccess()) {
            metrics.recordCompleted(workerId, durationMs);
            logger.info("Task {} completed by worker {} in {}ms", taskId, workerId, durationMs);
            events.publish(new CoordinatorEvent.TaskCompleted(taskId, workerId, result, Instant.now()));
            return;
        }

        metrics.recordFailed(workerId, durationMs);
        boolean retrying = shouldRetry(task);
        logger.warn("Task {} failed on worker {}: {}{}", taskId, workerId, result.getError(),
                retrying ? " (retrying)" : "");
        events.publish(new CoordinatorEvent.TaskFailed(taskId, workerId, result.getError(), retrying, Instant.now()));
        if (retrying) {
            retry(task);
        }
    }

    /**
     * Whether a failed task may go back on the queue.
     */
    public boolean shouldRetry(TaskRecord task) {
        if (task.getStatus() != TaskStatus.FAILED) {
            return false;
        }
        if (task.getHandoffCount() >= maxHandoffsForRetry) {
            return false;
        }
        if (!task.getPriority().isRetryable()) {
            return false;
        }
        return maxRetries == 0 || task.getRetryCount() < maxRetries;
    }

    private void retry(TaskRecord task) {
        try {
            task.retry();
        } catch (InvalidTransitionException e) {
            logger.warn("Could not retry task {}: {}", task.getTaskId(), e.getMessage());
            return;
        }
        queue.pushFront(task);
        metrics.recordRetried(task.getPriority());
        logger.info("Task {} requeued for retry #{}", task.getTaskId(), task.getRetryCount());
    }

    /**
     * Put a task that lost its worker back at the front of the queue. This is not
     * a failure and does not count as a retry.
     *
     * @param taskId the task to requeue
     * @param reason short description recorded in the event
     * @return true if the task was requeued
     */
    public boolean requeue(String taskId, String reason) {
        TaskRecord task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        Optional<String> previousWorker;
        try {
            previousWorker = task.requeue();
        } catch (InvalidTransitionException e) {
            logger.debug("Task {} not requeued: {}", taskId, e.getMessage());
            return false;
        }
        previousWorker.flatMap(registry::get).ifPresent(registration -> releaseWorker(registration, taskId));
        queue.pushFront(task);
        metrics.recordRequeued(reason);
        logger.info("Task {} requeued ({}), previous worker {}", taskId, reason, previousWorker.orElse("none"));
        events.publish(new CoordinatorEvent.TaskRequeued(taskId, previousWorker.orElse(null), reason, Instant.now()));
        return true;
    }

    /**
     * Requeue a task only while it is still assigned to {@code workerId}. Used when a
     * worker goes away, since its reservation may belong to a task committed elsewhere.
     *
     * @return true if the task was requeued
     */
    public boolean requeueIfAssigned(String taskId, String workerId, String reason) {
        TaskRecord task = tasks.get(taskId);
        if (task == null || !task.getAssignedWorker().map(workerId::equals).orElse(false)) {
            logger.debug("Task {} is not assigned to worker {}, not requeued", taskId, workerId);
            return false;
        }
        return requeue(taskId, reason);
    }

    /**
     * Release a worker from a task and announce it if it became available.
     */
    public void releaseWorker(WorkerRegistration registration, String taskId) {
        if (registration.release(taskId)) {
            publishAvailability(registration.getWorkerId(), Availability.BUSY, Availability.AVAILABLE);
        }
    }

    private void publishAvailability(String workerId, Availability previous, Availability current) {
        events.publish(new CoordinatorEvent.WorkerAvailabilityChanged(workerId, previous, current, Instant.now()));
    }

    private void onCoordinatorEvent(CoordinatorEvent event) {
        if (event instanceof CoordinatorEvent.WorkerAvailabilityChanged changed
                && changed.current() == Availability.AVAILABLE) {
            triggerAssignment();
        } else if (event instanceof CoordinatorEvent.WorkerRegistered) {
            triggerAssignment();
        }
    }

    // ==================== Queries ====================

    public Optional<TaskRecord> getTask(String taskId) {
        return taskId == null ? Optional.empty() : Optional.ofNullable(tasks.get(taskId));
    }

    public Collection<TaskRecord> getTasks() {
        return List.copyOf(tasks.values());
    }

    /**
     * Tasks currently held by a worker.
     */
    public Set<String> getTasksAssignedTo(String workerId) {
        return tasks.values().stream()
                .filter(task -> task.getStatus().isActive())
                .filter(task -> task.getAssignedWorker().map(workerId::equals).orElse(false))
                .map(TaskRecord::getTaskId)
                .collect(Collectors.toSet());
    }

    public QueueStatus getQueueStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskRecord task : tasks.values()) {
            counts.merge(task.getStatus(), 1, Integer::sum);
        }
        return new QueueStatus(counts, queue.size());
    }

    public int getQueueDepth() {
        return queue.size();
    }

    /**
     * Task ids in the order the next tick will visit them.
     */
    public List<String> getQueuedTaskIds() {
        return queue.inOrder().stream().map(TaskRecord::getTaskId).collect(Collectors.toList());
    }

    /**
     * Drop finished tasks from memory. Failed tasks the retry policy revived are
     * pending again and are kept.
     *
     * @return the number of tasks removed
     */
    public int purgeTerminalTasks() {
        int before = tasks.size();
        tasks.values().removeIf(task -> task.getStatus().isTerminal() && !queue.contains(task.getTaskId()));
        int removed = before - tasks.size();
        if (removed > 0) {
            logger.info("Purged {} finished task(s)", removed);
        }
        return removed;
    }
}
