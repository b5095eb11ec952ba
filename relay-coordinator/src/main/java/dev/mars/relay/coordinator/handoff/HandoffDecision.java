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

package dev.mars.relay.coordinator.handoff;

import dev.mars.relay.core.HandoffReason;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Outcome of a handoff evaluation: which kind of worker should take the task, and why.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class HandoffDecision {

    private final String ruleId;
    private final Pattern targetPattern;
    private final HandoffReason reason;

    HandoffDecision(String ruleId, Pattern targetPattern, HandoffReason reason) {
        this.ruleId = ruleId;
        this.targetPattern = Objects.requireNonNull(targetPattern, "Target pattern cannot be null");
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    /**
     * The rule that fired, empty for a directive carried by the task itself.
     */
    public Optional<String> getRuleId() {
        return Optional.ofNullable(ruleId);
    }

    public Pattern getTargetPattern() {
        return targetPattern;
    }

    public HandoffReason getReason() {
        return reason;
    }

    public boolean matchesTarget(String workerType) {
        return workerType != null && targetPattern.matcher(workerType).matches();
    }

    @Override
    public String toString() {
        return "HandoffDecision{" +
                "rule=" + (ruleId != null ? ruleId : "directive") +
                ", target=" + targetPattern.pattern() +
                ", reason=" + reason.getType().getValue() +
                '}';
    }
}
