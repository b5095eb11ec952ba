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

package dev.mars.relay.coordinator.observability;

import dev.mars.relay.core.TaskPriority;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * OpenTelemetry metrics for the coordinator.
 *
 * <ul>
 *   <li>relay.tasks.submitted (counter) - tasks accepted, by priority</li>
 *   <li>relay.tasks.completed (counter) - executions that succeeded</li>
 *   <li>relay.tasks.failed (counter) - executions that failed</li>
 *   <li>relay.tasks.retried (counter) - failed tasks put back on the queue</li>
 *   <li>relay.tasks.requeued (counter) - tasks returned after losing their worker</li>
 *   <li>relay.handoffs (counter) - settled handoffs, by outcome</li>
 *   <li>relay.task.duration.ms (histogram) - dispatch to completion</li>
 *   <li>relay.workers.available (gauge) - workers eligible for selection</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class CoordinatorMetrics implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CoordinatorMetrics.class);
    private static final String METER_NAME = "relay-coordinator";

    private static final AttributeKey<String> PRIORITY_KEY = AttributeKey.stringKey("priority");
    private static final AttributeKey<String> WORKER_KEY = AttributeKey.stringKey("worker.id");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");

    private final LongCounter tasksSubmitted;
    private final LongCounter tasksCompleted;
    private final LongCounter tasksFailed;
    private final LongCounter tasksRetried;
    private final LongCounter tasksRequeued;
    private final LongCounter handoffs;
    private final DoubleHistogram taskDuration;
    private final ObservableLongGauge workersAvailable;

    /**
     * Metrics registered with {@link GlobalOpenTelemetry}.
     */
    public CoordinatorMetrics(LongSupplier availableWorkers) {
        this(GlobalOpenTelemetry.get(), availableWorkers);
    }

    public CoordinatorMetrics(OpenTelemetry openTelemetry, LongSupplier availableWorkers) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        tasksSubmitted = meter.counterBuilder("relay.tasks.submitted")
                .setDescription("Number of tasks submitted")
                .setUnit("1")
                .build();

        tasksCompleted = meter.counterBuilder("relay.tasks.completed")
                .setDescription("Number of task executions that succeeded")
                .setUnit("1")
                .build();

        tasksFailed = meter.counterBuilder("relay.tasks.failed")
                .setDescription("Number of task executions that failed")
                .setUnit("1")
                .build();

        tasksRetried = meter.counterBuilder("relay.tasks.retried")
                .setDescription("Number of failed tasks put back on the queue")
                .setUnit("1")
                .build();

        tasksRequeued = meter.counterBuilder("relay.tasks.requeued")
                .setDescription("Number of tasks returned to the queue after losing their worker")
                .setUnit("1")
                .build();

        handoffs = meter.counterBuilder("relay.handoffs")
                .setDescription("Number of settled handoffs")
                .setUnit("1")
                .build();

        taskDuration = meter.histogramBuilder("relay.task.duration.ms")
                .setDescription("Time from dispatch to completion of a task execution")
                .setUnit("ms")
                .build();

        workersAvailable = meter.gaugeBuilder("relay.workers.available")
                .setDescription("Number of workers eligible for selection")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(availableWorkers.getAsLong()));

        logger.debug("CoordinatorMetrics initialized");
    }

    public void recordSubmitted(TaskPriority priority) {
        tasksSubmitted.add(1, Attributes.of(PRIORITY_KEY, priority.getValue()));
    }

    public void recordCompleted(String workerId, long durationMs) {
        Attributes attrs = Attributes.of(WORKER_KEY, workerId);
        tasksCompleted.add(1, attrs);
        taskDuration.record(durationMs, attrs);
    }

    public void recordFailed(String workerId, long durationMs) {
        Attributes attrs = Attributes.of(WORKER_KEY, workerId != null ? workerId : "unknown");
        tasksFailed.add(1, attrs);
        taskDuration.record(durationMs, attrs);
    }

    public void recordRetried(TaskPriority priority) {
        tasksRetried.add(1, Attributes.of(PRIORITY_KEY, priority.getValue()));
    }

    public void recordRequeued(String reason) {
        tasksRequeued.add(1, Attributes.of(REASON_KEY, reason));
    }

    public void recordHandoff(boolean success) {
        handoffs.add(1, Attributes.of(OUTCOME_KEY, success ? "success" : "failure"));
    }

    @Override
    public void close() {
        workersAvailable.close();
    }
}
