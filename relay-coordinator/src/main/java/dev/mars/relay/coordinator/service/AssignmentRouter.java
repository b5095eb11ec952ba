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

import dev.mars.relay.core.HandoffReason;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.TaskRecord;
import dev.mars.relay.worker.WorkerRegistration;

import java.util.Objects;
import java.util.Optional;

/**
 * Last-moment redirection of a task the assignment loop is about to commit.
 *
 * <p>The loop asks the router once per commit, after selection. When a route is
 * returned and its target can be reserved, the task goes to the target instead of
 * the selected worker and the redirection is recorded as a handoff.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@FunctionalInterface
public interface AssignmentRouter {

    /** Router that never redirects. */
    AssignmentRouter DIRECT = (task, selected) -> Optional.empty();

    /**
     * @param task the task being committed
     * @param selected the worker the selection algorithm picked
     * @return a different worker to use, if the task should not go to {@code selected}
     */
    Optional<Route> route(TaskRecord task, WorkerRegistration selected);

    /**
     * Where to send a task instead, and what it carries there.
     */
    final class Route {

        private final WorkerRegistration target;
        private final HandoffReason reason;
        private final TaskContext context;
        private final long contextSizeBytes;

        public Route(WorkerRegistration target, HandoffReason reason, TaskContext context, long contextSizeBytes) {
            this.target = Objects.requireNonNull(target, "Target cannot be null");
            this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
            this.context = Objects.requireNonNull(context, "Context cannot be null");
            this.contextSizeBytes = contextSizeBytes;
        }

        public WorkerRegistration getTarget() {
            return target;
        }

        public HandoffReason getReason() {
            return reason;
        }

        public TaskContext getContext() {
            return context;
        }

        public long getContextSizeBytes() {
            return contextSizeBytes;
        }
    }
}
