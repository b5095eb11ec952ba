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

import dev.mars.relay.core.HandoffRequest;

/**
 * Handle through which a worker reports to the coordinator it is registered with.
 * Implementations are thread-safe and may be called from any thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface WorkerSignals {

    /**
     * Report a change of the worker's own state.
     */
    void statusChanged(WorkerState state);

    /**
     * Ask the coordinator to move the worker's current task to another worker.
     */
    void requestHandoff(HandoffRequest request);
}
