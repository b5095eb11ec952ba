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
import dev.mars.relay.coordinator.support.CoordinatorFixture;
import dev.mars.relay.coordinator.support.TestWorker;
import dev.mars.relay.core.HandoffEvent;
import dev.mars.relay.core.HandoffReason;
import dev.mars.relay.core.HandoffReasonType;
import dev.mars.relay.core.QueueStatus;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.TaskPriority;
import dev.mars.relay.core.TaskRecord;
import dev.mars.relay.core.TaskSnapshot;
import dev.mars.relay.core.TaskStatus;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.core.exceptions.WorkerNotFoundException;
import dev.mars.relay.worker.Availability;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TaskSchedulerService}. Ticks are driven by hand; the periodic
 * timer only runs in the wake-up tests.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@ExtendWith(VertxExtension.class)
@DisplayName("TaskSchedulerService")
class TaskSchedulerServiceTest {

    private CoordinatorFixture fixture;
    private TaskSchedulerService scheduler;

    @BeforeEach
    void setUp(Vertx vertx) {
        fixture = new CoordinatorFixture(vertx, Map.of(CoordinatorConfig.HANDOFF_DEFAULT_RULES_ENABLED, "false"));
        scheduler = fixture.scheduler;
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private String submit(TaskPriority priority, String description, String... capabilities) {
        return scheduler.submit(List.of(capabilities), TaskContext.of(description), priority, null);
    }

    @Nested
    @DisplayName("Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("A: matching worker takes the task and completes it")
        void scenarioA() {
            TestWorker w1 = TestWorker.of("W1", "coding", "javascript").byDefault(TestWorker.Outcome.HOLD);
            fixture.registry.register(w1);
            String taskId = submit(TaskPriority.MEDIUM, "Add input validation", "coding", "javascript");

            assertEquals(1, scheduler.runAssignmentTick());

            TaskSnapshot running = fixture.task(taskId).snapshot();
            assertEquals(TaskStatus.IN_PROGRESS, running.getStatus());
            assertEquals("W1", running.getAssignedWorker().orElseThrow());
            assertEquals(Availability.BUSY, fixture.worker("W1").getAvailability());
            fixture.assertInProgressInvariant();

            assertTrue(w1.completeNext(true));

            TaskSnapshot done = fixture.task(taskId).snapshot();
            assertEquals(TaskStatus.COMPLETED, done.getStatus());
            assertTrue(done.getResult().orElseThrow().isSuccess());
            assertEquals(Availability.AVAILABLE, fixture.worker("W1").getAvailability());
            assertEquals(1, fixture.worker("W1").getPerformance().getTasksCompleted());
        }

        @Test
        @DisplayName("B: task goes to the worker with the capability")
        void scenarioB() {
            TestWorker w1 = TestWorker.of("W1", "coding");
            TestWorker w2 = TestWorker.of("W2", "planning");
            fixture.registry.register(w1);
            fixture.registry.register(w2);
            String taskId = submit(TaskPriority.MEDIUM, "Outline the quarter", "planning");

            scheduler.runAssignmentTick();

            assertEquals("W2", fixture.task(taskId).getAssignedWorker().orElseThrow());
            assertEquals(0, w1.getExecutionCount());
            assertEquals(1, w2.getExecutionCount());
        }

        @Test
        @DisplayName("C: busy worker leaves the task pending")
        void scenarioC() throws Exception {
            fixture.registry.register(TestWorker.of("W1", "coding"));
            fixture.registry.updateAvailability("W1", Availability.BUSY);
            String taskId = submit(TaskPriority.MEDIUM, "Fix the login form", "coding");

            assertEquals(0, scheduler.runAssignmentTick());

            TaskRecord task = fixture.task(taskId);
            assertEquals(TaskStatus.PENDING, task.getStatus());
            assertTrue(task.getAssignedWorker().isEmpty());
            assertEquals(1, scheduler.getQueueDepth());
        }

        @Test
        @DisplayName("D: failed high priority task is retried and completes")
        void scenarioD() {
            TestWorker w1 = TestWorker.of("W1", "coding").thenFail().thenSucceed();
            fixture.registry.register(w1);
            String taskId = submit(TaskPriority.HIGH, "Fix the login form", "coding");

            scheduler.runAssignmentTick();
            TaskRecord task = fixture.task(taskId);
            assertEquals(TaskStatus.PENDING, task.getStatus());
            assertEquals(List.of(taskId), scheduler.getQueuedTaskIds());

            scheduler.runAssignmentTick();

            assertEquals(TaskStatus.COMPLETED, task.getStatus());
            assertTrue(task.getHandoffHistory().isEmpty());
            assertEquals(1, task.getRetryCount());
            assertEquals(2, w1.getExecutionCount());
            CoordinatorEvent.TaskFailed failed = fixture.eventsOf(CoordinatorEvent.TaskFailed.class).get(0);
            assertTrue(failed.retrying());
        }

        @Test
        @DisplayName("E: empty requirements match any available worker")
        void scenarioE() {
            fixture.registry.register(TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD));
            String taskId = submit(TaskPriority.MEDIUM, "Anything will do");

            assertEquals(1, scheduler.runAssignmentTick());

            assertEquals("W1", fixture.task(taskId).getAssignedWorker().orElseThrow());
            assertEquals(TaskStatus.IN_PROGRESS, fixture.task(taskId).getStatus());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Critical task completes before a low task is assigned")
        void priorityOrdering() {
            TestWorker worker = TestWorker.of("W1", "coding");
            fixture.registry.register(worker);
            String low = submit(TaskPriority.LOW, "low", "coding");
            String critical = submit(TaskPriority.CRITICAL, "critical", "coding");
            String medium = submit(TaskPriority.MEDIUM, "medium", "coding");

            scheduler.runAssignmentTick();

            List<String> executed = worker.getReceived().stream().map(TaskContext::getTask).collect(Collectors.toList());
            assertEquals(List.of("critical", "medium", "low"), executed);

            int criticalCompleted = indexOf(CoordinatorEvent.TaskCompleted.class,
                    CoordinatorEvent.TaskCompleted::taskId, critical);
            int lowAssigned = indexOf(CoordinatorEvent.TaskAssigned.class, CoordinatorEvent.TaskAssigned::taskId, low);
            assertTrue(criticalCompleted >= 0 && criticalCompleted < lowAssigned);
            assertEquals(TaskStatus.COMPLETED, fixture.task(medium).getStatus());
        }

        @Test
        @DisplayName("Only available worker takes a task it has no capability for")
        void zeroCoverageWorkerTakesTask() {
            fixture.registry.register(TestWorker.of("W1", "java").byDefault(TestWorker.Outcome.HOLD));
            String rust = submit(TaskPriority.HIGH, "Port the crate", "rust");
            String java = submit(TaskPriority.MEDIUM, "Port the module", "java");

            scheduler.runAssignmentTick();

            assertEquals("W1", fixture.task(rust).getAssignedWorker().orElseThrow());
            assertEquals(List.of(java), scheduler.getQueuedTaskIds());
        }

        @Test
        @DisplayName("Unassignable task keeps its place while later tasks proceed")
        void unassignableKeepsPlace(Vertx vertx) {
            CoordinatorFixture strict = new CoordinatorFixture(vertx, Map.of(
                    CoordinatorConfig.SELECTION_WEIGHT_PERFORMANCE, "0",
                    CoordinatorConfig.HANDOFF_DEFAULT_RULES_ENABLED, "false"));
            strict.registry.register(TestWorker.of("W1", "java").byDefault(TestWorker.Outcome.HOLD));
            String rust = strict.scheduler.submit(Set.of("rust"), TaskContext.of("Port the crate"),
                    TaskPriority.HIGH, null);
            String java = strict.scheduler.submit(Set.of("java"), TaskContext.of("Port the module"),
                    TaskPriority.MEDIUM, null);

            assertEquals(1, strict.scheduler.runAssignmentTick());

            assertEquals(TaskStatus.IN_PROGRESS, strict.task(java).getStatus());
            assertEquals(TaskStatus.PENDING, strict.task(rust).getStatus());
            assertEquals(List.of(rust), strict.scheduler.getQueuedTaskIds());
        }

        @Test
        @DisplayName("Tick stops once no worker is available")
        void tickStopsWhenNoWorkerLeft() {
            TestWorker worker = TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD);
            fixture.registry.register(worker);
            submit(TaskPriority.MEDIUM, "one", "coding");
            submit(TaskPriority.MEDIUM, "two", "coding");
            submit(TaskPriority.MEDIUM, "three", "coding");

            assertEquals(1, scheduler.runAssignmentTick());
            assertEquals(2, scheduler.getQueueDepth());

            worker.completeNext(true);
            assertEquals(1, scheduler.runAssignmentTick());
            assertEquals(List.of("one", "two"),
                    worker.getReceived().stream().map(TaskContext::getTask).collect(Collectors.toList()));
        }

        private <E extends CoordinatorEvent> int indexOf(Class<E> type, Function<E, String> taskIdOf,
                                                         String taskId) {
            List<CoordinatorEvent> events = fixture.published;
            for (int i = 0; i < events.size(); i++) {
                CoordinatorEvent event = events.get(i);
                if (type.isInstance(event) && taskIdOf.apply(type.cast(event)).equals(taskId)) {
                    return i;
                }
            }
            return -1;
        }
    }

    @Nested
    @DisplayName("Retry policy")
    class RetryPolicyTests {

        @Test
        @DisplayName("Low priority failures are never retried")
        void lowPriorityNotRetried() {
            TestWorker worker = TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.FAIL);
            fixture.registry.register(worker);
            String taskId = submit(TaskPriority.LOW, "Tidy imports", "coding");

            scheduler.runAssignmentTick();
            scheduler.runAssignmentTick();

            TaskRecord task = fixture.task(taskId);
            assertEquals(TaskStatus.FAILED, task.getStatus());
            assertFalse(task.getResult().orElseThrow().isSuccess());
            assertEquals(1, worker.getExecutionCount());
            assertEquals(0, scheduler.getQueueDepth());
            assertFalse(fixture.eventsOf(CoordinatorEvent.TaskFailed.class).get(0).retrying());
        }

        @Test
        @DisplayName("Tasks with three handoffs are not retried")
        void handoffBoundStopsRetry() throws Exception {
            TaskRecord task = new TaskRecord.Builder()
                    .taskId("task-h")
                    .priority(TaskPriority.CRITICAL)
                    .context(TaskContext.of("Keep moving"))
                    .build();
            task.assign("a");
            task.beginExecution();
            HandoffReason reason = new HandoffReason(HandoffReasonType.OVERLOAD, "busy", null);
            task.handOff(HandoffEvent.pending("task-h", "a", "b", reason, 0), null);
            task.handOff(HandoffEvent.pending("task-h", "b", "c", reason, 0), null);
            long sequence = task.handOff(HandoffEvent.pending("task-h", "c", "d", reason, 0), null);
            task.complete(sequence, WorkerResult.failure("d", "gave up"));

            assertEquals(3, task.getHandoffCount());
            assertFalse(scheduler.shouldRetry(task));
        }

        @Test
        @DisplayName("Retry cap limits repeated failures")
        void retryCap(Vertx vertx) {
            CoordinatorFixture capped = new CoordinatorFixture(vertx, Map.of(
                    CoordinatorConfig.SCHEDULER_MAX_RETRIES, "2",
                    CoordinatorConfig.HANDOFF_DEFAULT_RULES_ENABLED, "false"));
            TestWorker worker = TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.FAIL);
            capped.registry.register(worker);
            String taskId = capped.scheduler.submit(Set.of("coding"), TaskContext.of("Flaky job"),
                    TaskPriority.HIGH, null);

            for (int i = 0; i < 5; i++) {
                capped.scheduler.runAssignmentTick();
            }

            TaskRecord task = capped.task(taskId);
            assertEquals(TaskStatus.FAILED, task.getStatus());
            assertEquals(2, task.getRetryCount());
            assertEquals(3, worker.getExecutionCount());
        }

        @Test
        @DisplayName("A throwing worker fails the task with the exception message")
        void synchronousThrow() {
            fixture.registry.register(TestWorker.of("W1", "coding").thenThrow());
            String taskId = submit(TaskPriority.LOW, "Crash please", "coding");

            scheduler.runAssignmentTick();

            TaskRecord task = fixture.task(taskId);
            assertEquals(TaskStatus.FAILED, task.getStatus());
            assertEquals("scripted exception", task.getResult().orElseThrow().getError());
            assertEquals(Availability.AVAILABLE, fixture.worker("W1").getAvailability());
            assertEquals(0.0, fixture.worker("W1").getPerformance().getSuccessRate(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Requeue")
    class RequeueTests {

        @Test
        @DisplayName("Late result after a requeue is ignored")
        void staleResultIgnored() {
            TestWorker worker = TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD);
            fixture.registry.register(worker);
            String taskId = submit(TaskPriority.MEDIUM, "Long job", "coding");
            scheduler.runAssignmentTick();

            assertTrue(scheduler.requeue(taskId, "test"));
            assertEquals(Availability.AVAILABLE, fixture.worker("W1").getAvailability());

            worker.completeNext(true);

            TaskRecord task = fixture.task(taskId);
            assertEquals(TaskStatus.PENDING, task.getStatus());
            assertTrue(task.getResult().isEmpty());
            assertEquals(List.of(taskId), scheduler.getQueuedTaskIds());
            assertTrue(fixture.eventsOf(CoordinatorEvent.TaskCompleted.class).isEmpty());
            assertEquals(1, fixture.eventsOf(CoordinatorEvent.TaskRequeued.class).size());
        }

        @Test
        @DisplayName("Requeued task goes to the front of the queue")
        void requeueGoesToFront() {
            fixture.registry.register(TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD));
            String first = submit(TaskPriority.LOW, "first", "coding");
            scheduler.runAssignmentTick();
            String second = submit(TaskPriority.CRITICAL, "second", "coding");

            scheduler.requeue(first, "test");

            assertEquals(List.of(first, second), scheduler.getQueuedTaskIds());
        }

        @Test
        @DisplayName("Finished tasks cannot be requeued")
        void finishedNotRequeued() {
            fixture.registry.register(TestWorker.of("W1", "coding"));
            String taskId = submit(TaskPriority.MEDIUM, "Quick job", "coding");
            scheduler.runAssignmentTick();

            assertFalse(scheduler.requeue(taskId, "test"));
            assertFalse(scheduler.requeue("task-unknown", "test"));
            assertEquals(TaskStatus.COMPLETED, fixture.task(taskId).getStatus());
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("In-progress tasks always sit on a busy worker")
        void inProgressImpliesBusy() {
            List<TestWorker> workers = List.of(
                    TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD),
                    TestWorker.of("W2", "coding", "testing").byDefault(TestWorker.Outcome.HOLD),
                    TestWorker.of("W3", "testing").byDefault(TestWorker.Outcome.HOLD));
            workers.forEach(fixture.registry::register);
            Random random = new Random(7);
            TaskPriority[] priorities = TaskPriority.values();

            for (int step = 0; step < 200; step++) {
                int action = random.nextInt(4);
                if (action == 0) {
                    submit(priorities[random.nextInt(priorities.length)], "job " + step,
                            random.nextBoolean() ? "coding" : "testing");
                } else if (action == 1) {
                    scheduler.runAssignmentTick();
                } else {
                    workers.get(random.nextInt(workers.size())).completeNext(random.nextBoolean());
                }
                fixture.assertInProgressInvariant();
                fixture.registry.getRegistrations().forEach(r -> {
                    double rate = r.getPerformance().getSuccessRate();
                    assertTrue(rate >= 0.0 && rate <= 1.0);
                });
            }
        }

        @Test
        @DisplayName("Queue status counts every task once")
        void queueStatusCounts() {
            TestWorker worker = TestWorker.of("W1", "coding").thenHold();
            fixture.registry.register(worker);
            submit(TaskPriority.MEDIUM, "a", "coding");
            submit(TaskPriority.MEDIUM, "b", "rust");
            scheduler.runAssignmentTick();

            QueueStatus status = scheduler.getQueueStatus();

            assertEquals(1, status.getInProgress());
            assertEquals(1, status.getPending());
            assertEquals(1, status.getQueueDepth());
            assertEquals(2, status.getTotalTasks());
        }

        @Test
        @DisplayName("Purge drops finished tasks only")
        void purgeFinished() {
            fixture.registry.register(TestWorker.of("W1", "coding"));
            String done = submit(TaskPriority.MEDIUM, "done", "coding");
            scheduler.runAssignmentTick();
            String waiting = submit(TaskPriority.MEDIUM, "waiting", "rust");

            assertEquals(1, scheduler.purgeTerminalTasks());

            assertTrue(scheduler.getTask(done).isEmpty());
            assertTrue(scheduler.getTask(waiting).isPresent());
        }
    }

    @Nested
    @DisplayName("Interleavings")
    class InterleavingTests {

        private final AtomicBoolean fired = new AtomicBoolean();

        private void onFirstReservation(Consumer<String> action) {
            fixture.events.addListener(event -> {
                if (event instanceof CoordinatorEvent.WorkerAvailabilityChanged
                        && ((CoordinatorEvent.WorkerAvailabilityChanged) event).current() == Availability.BUSY
                        && fired.compareAndSet(false, true)) {
                    action.accept(((CoordinatorEvent.WorkerAvailabilityChanged) event).workerId());
                }
            });
        }

        @Test
        @DisplayName("New instance under a busy id inherits the task and takes no second one")
        void reRegisterWhileBusy() {
            TestWorker first = TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD);
            fixture.registry.register(first);
            String t1 = submit(TaskPriority.MEDIUM, "first", "coding");
            scheduler.runAssignmentTick();

            TestWorker second = TestWorker.of("W1", "coding").byDefault(TestWorker.Outcome.HOLD);
            fixture.registry.register(second);
            String t2 = submit(TaskPriority.MEDIUM, "second", "coding");

            assertEquals(0, scheduler.runAssignmentTick());
            assertEquals(TaskStatus.PENDING, fixture.task(t2).getStatus());
            assertEquals(Availability.BUSY, fixture.worker("W1").getAvailability());
            assertEquals(t1, fixture.worker("W1").getCurrentTaskId().orElseThrow());
            fixture.assertInProgressInvariant();

            assertTrue(first.completeNext(true));

            assertEquals(TaskStatus.COMPLETED, fixture.task(t1).getStatus());
            assertEquals(Availability.AVAILABLE, fixture.worker("W1").getAvailability());
            assertEquals(1, scheduler.runAssignmentTick());
            assertEquals(1, first.getExecutionCount());
            assertEquals(1, second.getExecutionCount());
            fixture.assertInProgressInvariant();
        }

        @Test
        @DisplayName("Worker removed between reservation and commit gets no task")
        void unregisteredDuringCommit() {
            TestWorker w1 = TestWorker.of("W1", "coding");
            fixture.registry.register(w1);
            onFirstReservation(workerId -> {
                try {
                    fixture.unregister(workerId);
                } catch (WorkerNotFoundException e) {
                    throw new IllegalStateException(e);
                }
            });
            String taskId = submit(TaskPriority.MEDIUM, "Fix the login form", "coding");

            assertEquals(0, scheduler.runAssignmentTick());

            TaskRecord task = fixture.task(taskId);
            assertEquals(TaskStatus.PENDING, task.getStatus());
            assertTrue(task.getAssignedWorker().isEmpty());
            assertFalse(fixture.registry.isRegistered("W1"));
            assertEquals(0, w1.getExecutionCount());
            assertEquals(1, scheduler.getQueueDepth());
            fixture.assertInProgressInvariant();

            TestWorker w2 = TestWorker.of("W2", "coding");
            fixture.registry.register(w2);
            scheduler.runAssignmentTick();
            assertEquals(TaskStatus.COMPLETED, task.getStatus());
            assertEquals(1, w2.getExecutionCount());
        }

        @Test
        @DisplayName("Worker replaced between reservation and commit is released")
        void replacedDuringCommit() {
            TestWorker original = TestWorker.of("W1", "coding");
            TestWorker replacement = TestWorker.of("W1", "coding");
            fixture.registry.register(original);
            onFirstReservation(workerId -> fixture.registry.register(replacement));
            String taskId = submit(TaskPriority.MEDIUM, "Fix the login form", "coding");

            assertEquals(0, scheduler.runAssignmentTick());

            assertEquals(TaskStatus.PENDING, fixture.task(taskId).getStatus());
            assertSame(replacement, fixture.worker("W1").getWorker());
            assertEquals(Availability.AVAILABLE, fixture.worker("W1").getAvailability());
            assertTrue(fixture.worker("W1").getCurrentTaskId().isEmpty());
            assertEquals(0, original.getExecutionCount());

            assertEquals(1, scheduler.runAssignmentTick());
            assertEquals(TaskStatus.COMPLETED, fixture.task(taskId).getStatus());
            assertEquals(1, replacement.getExecutionCount());
        }

        @Test
        @DisplayName("Health sweep between reservation and commit leaves the task queued")
        void sweptDuringCommit() {
            TestWorker w1 = TestWorker.of("W1", "coding");
            fixture.registry.register(w1);
            onFirstReservation(workerId -> fixture.healthMonitor.runSweep(Instant.now().plus(Duration.ofMinutes(10))));
            String taskId = submit(TaskPriority.MEDIUM, "Fix the login form", "coding");

            assertEquals(0, scheduler.runAssignmentTick());

            assertEquals(TaskStatus.PENDING, fixture.task(taskId).getStatus());
            assertEquals(Availability.OFFLINE, fixture.worker("W1").getAvailability());
            assertEquals(0, w1.getExecutionCount());
            assertEquals(1, scheduler.getQueueDepth());
            assertEquals(1, fixture.eventsOf(CoordinatorEvent.WorkerUnresponsive.class).size());
            assertTrue(fixture.eventsOf(CoordinatorEvent.TaskRequeued.class).isEmpty());
            fixture.assertInProgressInvariant();
        }
    }

    @Nested
    @DisplayName("Wake-up")
    class WakeUpTests {

        @Test
        @DisplayName("Registering a worker triggers an assignment without waiting for the timer")
        void registrationWakesScheduler(Vertx vertx) {
            CoordinatorFixture slow = new CoordinatorFixture(vertx, Map.of(
                    CoordinatorConfig.SCHEDULER_INTERVAL_MS, "600000",
                    CoordinatorConfig.HANDOFF_DEFAULT_RULES_ENABLED, "false"));
            slow.scheduler.start();
            try {
                String taskId = slow.scheduler.submit(Set.of("coding"), TaskContext.of("Waiting for help"),
                        TaskPriority.MEDIUM, null);
                slow.registry.register(TestWorker.of("W1", "coding"));

                await().atMost(Duration.ofSeconds(5))
                        .until(() -> slow.task(taskId).getStatus() == TaskStatus.COMPLETED);
            } finally {
                slow.scheduler.stop();
            }
        }

        @Test
        @DisplayName("A worker made available again picks up waiting work")
        void availabilityWakesScheduler(Vertx vertx) throws Exception {
            CoordinatorFixture slow = new CoordinatorFixture(vertx, Map.of(
                    CoordinatorConfig.SCHEDULER_INTERVAL_MS, "600000",
                    CoordinatorConfig.HANDOFF_DEFAULT_RULES_ENABLED, "false"));
            slow.registry.register(TestWorker.of("W1", "coding"));
            slow.registry.updateAvailability("W1", Availability.BUSY);
            slow.scheduler.start();
            try {
                String taskId = slow.scheduler.submit(Set.of("coding"), TaskContext.of("Waiting for W1"),
                        TaskPriority.MEDIUM, null);
                assertEquals(TaskStatus.PENDING, slow.task(taskId).getStatus());

                slow.registry.updateAvailability("W1", Availability.AVAILABLE);

                await().atMost(Duration.ofSeconds(5))
                        .until(() -> slow.task(taskId).getStatus() == TaskStatus.COMPLETED);
            } finally {
                slow.scheduler.stop();
            }
        }

        @Test
        @DisplayName("Periodic timer assigns queued tasks")
        void periodicTimer(Vertx vertx) {
            CoordinatorFixture fast = new CoordinatorFixture(vertx, Map.of(
                    CoordinatorConfig.SCHEDULER_INTERVAL_MS, "20",
                    CoordinatorConfig.HANDOFF_DEFAULT_RULES_ENABLED, "false"));
            fast.registry.register(TestWorker.of("W1", "coding"));
            String taskId = fast.scheduler.submit(Set.of("coding"), TaskContext.of("Tick me"),
                    TaskPriority.MEDIUM, null);
            fast.scheduler.start();
            try {
                assertTrue(fast.scheduler.isRunning());
                await().atMost(Duration.ofSeconds(5))
                        .until(() -> fast.task(taskId).getStatus() == TaskStatus.COMPLETED);
            } finally {
                fast.scheduler.stop();
            }
            assertFalse(fast.scheduler.isRunning());
        }
    }
}
