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

import dev.mars.relay.core.HandoffEvent;
import dev.mars.relay.core.HandoffReasonType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate figures over settled handoffs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class HandoffStats {

    private final int totalHandoffs;
    private final int successfulHandoffs;
    private final int pendingHandoffs;
    private final double averageDurationMs;
    private final Map<HandoffReasonType, Integer> handoffsByReason;

    private HandoffStats(int totalHandoffs, int successfulHandoffs, int pendingHandoffs,
                         double averageDurationMs, Map<HandoffReasonType, Integer> handoffsByReason) {
        this.totalHandoffs = totalHandoffs;
        this.successfulHandoffs = successfulHandoffs;
        this.pendingHandoffs = pendingHandoffs;
        this.averageDurationMs = averageDurationMs;
        this.handoffsByReason = Collections.unmodifiableMap(handoffsByReason);
    }

    /**
     * Compute the figures. Events that have not settled yet are only counted in
     * {@link #getPendingHandoffs()}.
     */
    public static HandoffStats of(Collection<HandoffEvent> events) {
        int total = 0;
        int successful = 0;
        int pending = 0;
        long durationSum = 0L;
        Map<HandoffReasonType, Integer> byReason = new EnumMap<>(HandoffReasonType.class);
        for (HandoffEvent event : events) {
            if (!event.isSettled()) {
                pending++;
                continue;
            }
            total++;
            if (event.isSuccess()) {
                successful++;
            }
            durationSum += event.getDurationMs();
            byReason.merge(event.getReason().getType(), 1, Integer::sum);
        }
        double average = total > 0 ? (double) durationSum / total : 0.0;
        return new HandoffStats(total, successful, pending, average, byReason);
    }

    public int getTotalHandoffs() {
        return totalHandoffs;
    }

    public int getSuccessfulHandoffs() {
        return successfulHandoffs;
    }

    public int getPendingHandoffs() {
        return pendingHandoffs;
    }

    /**
     * Share of settled handoffs whose receiving execution succeeded, {@code 0} when there are none.
     */
    public double getSuccessRate() {
        return totalHandoffs > 0 ? (double) successfulHandoffs / totalHandoffs : 0.0;
    }

    public double getAverageDurationMs() {
        return averageDurationMs;
    }

    public Map<HandoffReasonType, Integer> getHandoffsByReason() {
        return handoffsByReason;
    }

    public int getCount(HandoffReasonType type) {
        return handoffsByReason.getOrDefault(type, 0);
    }

    @Override
    public String toString() {
        return String.format("HandoffStats{total=%d, successRate=%.2f, avgDuration=%.1fms, pending=%d, byReason=%s}",
                totalHandoffs, getSuccessRate(), averageDurationMs, pendingHandoffs, handoffsByReason);
    }
}
