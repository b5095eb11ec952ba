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

package dev.mars.relay.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkerPerformance}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("WorkerPerformance")
class WorkerPerformanceTest {

    @Test
    @DisplayName("Running means over a few executions")
    void runningMeans() {
        WorkerPerformance performance = WorkerPerformance.INITIAL
                .record(true, 100)
                .record(false, 300)
                .record(true, 200)
                .record(true, 400);

        assertEquals(4, performance.getTasksCompleted());
        assertEquals(0.75, performance.getSuccessRate(), 1e-9);
        assertEquals(250.0, performance.getAverageResponseTimeMs(), 1e-9);
    }

    @Test
    @DisplayName("First execution replaces the initial figures")
    void firstExecution() {
        WorkerPerformance performance = WorkerPerformance.INITIAL.record(false, 80);

        assertEquals(0.0, performance.getSuccessRate(), 1e-9);
        assertEquals(80.0, performance.getAverageResponseTimeMs(), 1e-9);
    }

    @Test
    @DisplayName("Success rate stays within [0, 1] for any sequence")
    void successRateBounded() {
        Random random = new Random(42);
        WorkerPerformance performance = WorkerPerformance.INITIAL;
        for (int i = 0; i < 10_000; i++) {
            performance = performance.record(random.nextBoolean(), random.nextInt(5000) - 100);
            assertTrue(performance.getSuccessRate() >= 0.0 && performance.getSuccessRate() <= 1.0);
            assertTrue(performance.getAverageResponseTimeMs() >= 0.0);
        }
    }

    @Test
    @DisplayName("Out of range figures are rejected")
    void rejectsInvalidFigures() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPerformance(1.5, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new WorkerPerformance(0.5, -1, 0));
    }
}
