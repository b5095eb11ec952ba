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
import dev.mars.relay.core.HandoffReason;
import dev.mars.relay.core.HandoffReasonType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HandoffStats")
class HandoffStatsTest {

    private static HandoffEvent event(HandoffReasonType type) {
        return HandoffEvent.pending("task-1", "A", "B", new HandoffReason(type, "", null), 42);
    }

    @Test
    @DisplayName("Empty history gives zeroes")
    void empty() {
        HandoffStats stats = HandoffStats.of(List.of());

        assertEquals(0, stats.getTotalHandoffs());
        assertEquals(0.0, stats.getSuccessRate());
        assertEquals(0.0, stats.getAverageDurationMs());
        assertTrue(stats.getHandoffsByReason().isEmpty());
    }

    @Test
    @DisplayName("Only settled handoffs count towards rate and duration")
    void settledOnly() {
        HandoffStats stats = HandoffStats.of(List.of(
                event(HandoffReasonType.OVERLOAD).settle(true, 100),
                event(HandoffReasonType.OVERLOAD).settle(false, 300),
                event(HandoffReasonType.EXPERTISE_REQUIRED).settle(true, 200),
                event(HandoffReasonType.FAILURE)));

        assertEquals(3, stats.getTotalHandoffs());
        assertEquals(2, stats.getSuccessfulHandoffs());
        assertEquals(1, stats.getPendingHandoffs());
        assertEquals(2.0 / 3.0, stats.getSuccessRate(), 1e-9);
        assertEquals(200.0, stats.getAverageDurationMs(), 1e-9);
        assertEquals(2, stats.getCount(HandoffReasonType.OVERLOAD));
        assertEquals(1, stats.getCount(HandoffReasonType.EXPERTISE_REQUIRED));
        assertEquals(0, stats.getCount(HandoffReasonType.FAILURE));
    }
}
