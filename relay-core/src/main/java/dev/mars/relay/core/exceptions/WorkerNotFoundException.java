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

package dev.mars.relay.core.exceptions;

/**
 * Thrown when an operation names a worker that is not in the registration table.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class WorkerNotFoundException extends RelayException {

    private final String workerId;

    public WorkerNotFoundException(String workerId) {
        super("Worker not registered: " + workerId);
        this.workerId = workerId;
    }

    public String getWorkerId() {
        return workerId;
    }
}
