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
 * One condition of a {@link HandoffRule}: the named condition's value is compared
 * against {@code threshold} with {@code operator}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class HandoffTrigger {

    @JsonProperty("condition")
    private final String condition;

    @JsonProperty("operator")
    private final ComparisonOperator operator;

    @JsonProperty("threshold")
    private final double threshold;

    public HandoffTrigger(String condition, ComparisonOperator operator, double threshold) {
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        this.threshold = threshold;
    }

    /**
     * Trigger that fires when the named boolean condition holds.
     */
    public static HandoffTrigger whenTrue(String condition) {
        return new HandoffTrigger(condition, ComparisonOperator.EQ, 1);
    }

    public String getCondition() {
        return condition;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandoffTrigger that = (HandoffTrigger) o;
        return Double.compare(that.threshold, threshold) == 0
                && condition.equals(that.condition)
                && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, operator, threshold);
    }

    @Override
    public String toString() {
        return condition + " " + operator.getValue() + " " + threshold;
    }
}
