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

import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.WorkerResult;
import io.vertx.core.Future;

import java.util.Set;

/**
 * Contract between the coordinator and an external unit of work execution.
 *
 * <p>The coordinator only ever calls these methods. Everything else about a
 * worker (how it talks to a model, which tools it drives, where its output goes)
 * is outside the coordinator's concern.</p>
 *
 * <h3>Execution:</h3>
 * <p>{@link #execute(TaskContext)} must not block. The returned future completes
 * with the worker's result; a failed future or an exception thrown from the call
 * itself is treated as a failed execution.</p>
 *
 * <h3>Signals:</h3>
 * <p>On registration the coordinator calls {@link #bind(WorkerSignals)} with the
 * handle the worker uses to report status changes and request handoffs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public interface Worker {

    /**
     * Unique, stable identifier of this worker.
     */
    String getWorkerId();

    /**
     * Declared type matched by handoff rules, for example {@code "coding"}.
     * Defaults to the implementing class's simple name.
     */
    default String getWorkerType() {
        return getClass().getSimpleName();
    }

    /**
     * Capabilities the worker currently offers. Read on every registration.
     */
    Set<String> listCapabilities();

    /**
     * Start executing a task.
     *
     * @param context the task payload
     * @return a future completed with the result of the execution
     */
    Future<WorkerResult> execute(TaskContext context);

    /**
     * Receive the signal handle. Called on every registration.
     */
    default void bind(WorkerSignals signals) {
    }
}
