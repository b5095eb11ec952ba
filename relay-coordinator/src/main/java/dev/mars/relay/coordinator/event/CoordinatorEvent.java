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

package dev.mars.relay.coordinator.event;

import dev.mars.relay.core.HandoffEvent;
import dev.mars.relay.core.TaskPriority;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.worker.Availability;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Sealed family of notifications published by the coordinator.
 *
 * <p>Each permitted subtype carries only the fields relevant to what happened.
 * Listeners dispatch with {@code instanceof} patterns.</p>
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link WorkerRegistered}, {@link WorkerUnregistered}</li>
 *   <li>{@link WorkerAvailabilityChanged}, {@link WorkerUnresponsive}</li>
 *   <li>{@link TaskSubmitted}, {@link TaskAssigned}, {@link TaskRequeued}</li>
 *   <li>{@link TaskCompleted}, {@link TaskFailed}</li>
 *   <li>{@link TaskHandoff}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public sealed interface CoordinatorEvent
        permits CoordinatorEvent.WorkerRegistered,
                CoordinatorEvent.WorkerUnregistered,
                CoordinatorEvent.WorkerAvailabilityChanged,
                CoordinatorEvent.WorkerUnresponsive,
                CoordinatorEvent.TaskSubmitted,
                CoordinatorEvent.TaskAssigned,
                CoordinatorEvent.TaskRequeued,
                CoordinatorEvent.TaskCompleted,
                CoordinatorEvent.TaskFailed,
                CoordinatorEvent.TaskHandoff {

    /** Common accessor: every subtype carries the time it was raised. */
    Instant timestamp();

    /**
     * A worker joined, or registered again with refreshed capabilities.
     *
     * @param workerId     the worker identifier
     * @param workerType   the declared worker type
     * @param capabilities the capabilities read at registration
     * @param reRegistered true if the worker was already registered
     * @param timestamp    when the registration happened
     */
    record WorkerRegistered(String workerId, String workerType, Set<String> capabilities,
                            boolean reRegistered, Instant timestamp) implements CoordinatorEvent {
        public WorkerRegistered {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(timestamp, "timestamp");
            capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        }
    }

    /**
     * A worker was removed.
     *
     * @param workerId      the worker identifier
     * @param requeuedTask  the in-flight task moved back to the queue, or null
     * @param timestamp     when the removal happened
     */
    record WorkerUnregistered(String workerId, String requeuedTask, Instant timestamp) implements CoordinatorEvent {
        public WorkerUnregistered {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    record WorkerAvailabilityChanged(String workerId, Availability previous, Availability current,
                                     Instant timestamp) implements CoordinatorEvent {
        public WorkerAvailabilityChanged {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(current, "current");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * The health monitor found a worker inactive past the threshold.
     *
     * @param workerId     the worker identifier
     * @param lastActivity the last activity seen
     * @param timestamp    when the sweep flagged it
     */
    record WorkerUnresponsive(String workerId, Instant lastActivity, Instant timestamp) implements CoordinatorEvent {
        public WorkerUnresponsive {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    record TaskSubmitted(String taskId, TaskPriority priority, Set<String> requiredCapabilities,
                         Instant timestamp) implements CoordinatorEvent {
        public TaskSubmitted {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(priority, "priority");
            Objects.requireNonNull(timestamp, "timestamp");
            requiredCapabilities = requiredCapabilities != null ? Set.copyOf(requiredCapabilities) : Set.of();
        }
    }

    record TaskAssigned(String taskId, String workerId, Instant timestamp) implements CoordinatorEvent {
        public TaskAssigned {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * A task went back to the front of the queue without failing, because its
     * worker was unregistered or found unresponsive.
     *
     * @param taskId         the task identifier
     * @param previousWorker the worker that held it
     * @param reason         short description of why
     * @param timestamp      when the requeue happened
     */
    record TaskRequeued(String taskId, String previousWorker, String reason,
                        Instant timestamp) implements CoordinatorEvent {
        public TaskRequeued {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    record TaskCompleted(String taskId, String workerId, WorkerResult result,
                         Instant timestamp) implements CoordinatorEvent {
        public TaskCompleted {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(result, "result");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * An execution failed.
     *
     * @param taskId    the task identifier
     * @param workerId  the worker that ran it
     * @param error     the error reported
     * @param retrying  true if the retry policy put the task back on the queue
     * @param timestamp when the failure was recorded
     */
    record TaskFailed(String taskId, String workerId, String error, boolean retrying,
                      Instant timestamp) implements CoordinatorEvent {
        public TaskFailed {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * A handoff was committed, or its receiving execution settled. The two cases
     * are told apart by {@link HandoffEvent#isSettled()}.
     *
     * @param taskId    the task identifier
     * @param handoff   the handoff event as recorded at that moment
     * @param timestamp when it was published
     */
    record TaskHandoff(String taskId, HandoffEvent handoff, Instant timestamp) implements CoordinatorEvent {
        public TaskHandoff {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(handoff, "handoff");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
