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
 * Comparison applied between a condition's value and a trigger threshold.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ComparisonOperator {

    GT("gt"),
    LT("lt"),
    EQ("eq"),
    GTE("gte"),
    LTE("lte");

    private final String value;

    ComparisonOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean test(double conditionValue, double threshold) {
        switch (this) {
            case GT:
                return conditionValue > threshold;
            case LT:
                return conditionValue < threshold;
            case GTE:
                return conditionValue >= threshold;
            case LTE:
                return conditionValue <= threshold;
            default:
                return Double.compare(conditionValue, threshold) == 0;
        }
    }

    public static ComparisonOperator fromValue(String value) {
        for (ComparisonOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value) || operator.name().equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
