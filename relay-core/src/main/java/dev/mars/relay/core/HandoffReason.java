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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Why a task moved from one worker to another.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class HandoffReason {

    @JsonProperty("type")
    private final HandoffReasonType type;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("severity")
    private final HandoffSeverity severity;

    public HandoffReason(HandoffReasonType type, String description, HandoffSeverity severity) {
        this.type = Objects.requireNonNull(type, "Reason type cannot be null");
        this.description = description != null ? description : "";
        this.severity = severity != null ? severity : HandoffSeverity.MODERATE;
    }

    public HandoffReasonType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public HandoffSeverity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandoffReason that = (HandoffReason) o;
        return type == that.type && description.equals(that.description) && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, description, severity);
    }

    @Override
    public String toString() {
        return type.getValue() + "/" + severity.getValue() + ": " + description;
    }
}
