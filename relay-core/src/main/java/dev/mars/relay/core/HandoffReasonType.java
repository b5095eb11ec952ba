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
 * Category of a handoff.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum HandoffReasonType {

    CAPABILITY_MISMATCH("capability_mismatch"),
    OVERLOAD("overload"),
    EXPERTISE_REQUIRED("expertise_required"),
    FAILURE("failure"),
    OPTIMIZATION("optimization"),
    PLANNED_TRANSITION("planned_transition");

    private final String value;

    HandoffReasonType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static HandoffReasonType fromValue(String value) {
        for (HandoffReasonType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown handoff reason type: " + value);
    }
}
