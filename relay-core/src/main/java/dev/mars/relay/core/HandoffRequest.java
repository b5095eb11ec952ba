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

package dev.mars.relay.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Request raised by a worker that wants to give its current task to another worker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class HandoffRequest {

    private final String taskId;
    private final String fromWorkerId;
    private final HandoffReason reason;
    private final Set<String> requiredCapabilities;
    private final HandoffUrgency urgency;

    public HandoffRequest(String taskId, String fromWorkerId, HandoffReason reason,
                          Set<String> requiredCapabilities, HandoffUrgency urgency) {
        this.taskId = Objects.requireNonNull(taskId, "Task id cannot be null");
        this.fromWorkerId = Objects.requireNonNull(fromWorkerId, "From worker id cannot be null");
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
        this.requiredCapabilities = requiredCapabilities != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities))
                : Collections.emptySet();
        this.urgency = urgency != null ? urgency : HandoffUrgency.MEDIUM;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getFromWorkerId() {
        return fromWorkerId;
    }

    public HandoffReason getReason() {
        return reason;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public HandoffUrgency getUrgency() {
        return urgency;
    }

    @Override
    public String toString() {
        return "HandoffRequest{" +
                "taskId='" + taskId + '\'' +
                ", from='" + fromWorkerId + '\'' +
                ", reason=" + reason +
                ", capabilities=" + requiredCapabilities +
                ", urgency=" + urgency +
                '}';
    }
}
