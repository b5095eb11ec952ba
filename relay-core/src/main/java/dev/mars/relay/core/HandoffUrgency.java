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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency attached to a worker-initiated handoff request.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum HandoffUrgency {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    HandoffUrgency(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Map the urgency of a request onto the severity recorded in its handoff event.
     */
    public HandoffSeverity toSeverity() {
        switch (this) {
            case CRITICAL:
                return HandoffSeverity.CRITICAL;
            case HIGH:
                return HandoffSeverity.MAJOR;
            case MEDIUM:
                return HandoffSeverity.MODERATE;
            default:
                return HandoffSeverity.MINOR;
        }
    }
}
