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

package dev.mars.relay.coordinator.service;

import java.util.Objects;

/**
 * Named parameters of the worker scoring formula.
 *
 * <pre>
 *   performanceScore = successRate * successRateWeight
 *                    + min(1, referenceLatencyMs / averageResponseTimeMs) * responseTimeWeight
 *   totalScore       = capabilityScore * capabilityWeight
 *                    + performanceScore * performanceWeight
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class SelectionWeights {

    public static final double DEFAULT_CAPABILITY_WEIGHT = 0.7;
    public static final double DEFAULT_PERFORMANCE_WEIGHT = 0.3;
    public static final double DEFAULT_SUCCESS_RATE_WEIGHT = 0.6;
    public static final double DEFAULT_RESPONSE_TIME_WEIGHT = 0.4;
    public static final double DEFAULT_REFERENCE_LATENCY_MS = 1000.0;

    public static final SelectionWeights DEFAULTS = new Builder().build();

    private final double capabilityWeight;
    private final double performanceWeight;
    private final double successRateWeight;
    private final double responseTimeWeight;
    private final double referenceLatencyMs;

    private SelectionWeights(Builder builder) {
        this.capabilityWeight = requireNonNegative("capabilityWeight", builder.capabilityWeight);
        this.performanceWeight = requireNonNegative("performanceWeight", builder.performanceWeight);
        this.successRateWeight = requireNonNegative("successRateWeight", builder.successRateWeight);
        this.responseTimeWeight = requireNonNegative("responseTimeWeight", builder.responseTimeWeight);
        if (!(builder.referenceLatencyMs > 0)) {
            throw new IllegalArgumentException("referenceLatencyMs must be positive: " + builder.referenceLatencyMs);
        }
        this.referenceLatencyMs = builder.referenceLatencyMs;
    }

    public double getCapabilityWeight() {
        return capabilityWeight;
    }

    public double getPerformanceWeight() {
        return performanceWeight;
    }

    public double getSuccessRateWeight() {
        return successRateWeight;
    }

    public double getResponseTimeWeight() {
        return responseTimeWeight;
    }

    public double getReferenceLatencyMs() {
        return referenceLatencyMs;
    }

    private static double requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectionWeights that = (SelectionWeights) o;
        return Double.compare(that.capabilityWeight, capabilityWeight) == 0
                && Double.compare(that.performanceWeight, performanceWeight) == 0
                && Double.compare(that.successRateWeight, successRateWeight) == 0
                && Double.compare(that.responseTimeWeight, responseTimeWeight) == 0
                && Double.compare(that.referenceLatencyMs, referenceLatencyMs) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(capabilityWeight, performanceWeight, successRateWeight,
                responseTimeWeight, referenceLatencyMs);
    }

    @Override
    public String toString() {
        return "SelectionWeights{capability=" + capabilityWeight +
                ", performance=" + performanceWeight +
                ", successRate=" + successRateWeight +
                ", responseTime=" + responseTimeWeight +
                ", referenceLatencyMs=" + referenceLatencyMs + '}';
    }

    /**
     * Builder for creating SelectionWeights instances. Starts from the defaults.
     */
    public static class Builder {
        private double capabilityWeight = DEFAULT_CAPABILITY_WEIGHT;
        private double performanceWeight = DEFAULT_PERFORMANCE_WEIGHT;
        private double successRateWeight = DEFAULT_SUCCESS_RATE_WEIGHT;
        private double responseTimeWeight = DEFAULT_RESPONSE_TIME_WEIGHT;
        private double referenceLatencyMs = DEFAULT_REFERENCE_LATENCY_MS;

        public Builder capabilityWeight(double capabilityWeight) {
            this.capabilityWeight = capabilityWeight;
            return this;
        }

        public Builder performanceWeight(double performanceWeight) {
            this.performanceWeight = performanceWeight;
            return this;
        }

        public Builder successRateWeight(double successRateWeight) {
            this.successRateWeight = successRateWeight;
            return this;
        }

        public Builder responseTimeWeight(double responseTimeWeight) {
            this.responseTimeWeight = responseTimeWeight;
            return this;
        }

        public Builder referenceLatencyMs(double referenceLatencyMs) {
            this.referenceLatencyMs = referenceLatencyMs;
            return this;
        }

        public SelectionWeights build() {
            return new SelectionWeights(this);
        }
    }
}
