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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Record of one transfer of a task between two workers.
 *
 * <p>An event is appended to the task's handoff history as soon as the transfer is
 * committed, unsettled and with {@code success=false}. It is replaced by its
 * {@link #settle settled} copy once the receiving worker's execution finishes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class HandoffEvent {

    @JsonProperty("eventId")
    private final String eventId;

    @JsonProperty("taskId")
    private final String taskId;

    @JsonProperty("fromWorker")
    private final String fromWorker;

    @JsonProperty("toWorker")
    private final String toWorker;

    @JsonProperty("reason")
    private final HandoffReason reason;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("durationMs")
    private final long durationMs;

    @JsonProperty("contextSizeBytes")
    private final long contextSizeBytes;

    @JsonProperty("settled")
    private final boolean settled;

    private HandoffEvent(String eventId, String taskId, String fromWorker, String toWorker,
                         HandoffReason reason, Instant timestamp, boolean success,
                         long durationMs, long contextSizeBytes, boolean settled) {
        this.eventId = eventId;
        this.taskId = taskId;
        this.fromWorker = fromWorker;
        this.toWorker = toWorker;
        this.reason = reason;
        this.timestamp = timestamp;
        this.success = success;
        this.durationMs = durationMs;
        this.contextSizeBytes = contextSizeBytes;
        this.settled = settled;
    }

    /**
     * Create the placeholder appended when a transfer is committed.
     */
    public static HandoffEvent pending(String taskId, String fromWorker, String toWorker,
                                       HandoffReason reason, long contextSizeBytes) {
        return new HandoffEvent(UUID.randomUUID().toString(),
                Objects.requireNonNull(taskId, "Task id cannot be null"),
                fromWorker,
                Objects.requireNonNull(toWorker, "To worker cannot be null"),
                Objects.requireNonNull(reason, "Reason cannot be null"),
                Instant.now(), false, 0L, contextSizeBytes, false);
    }

    /**
     * Settled copy of this event.
     *
     * @param success whether the receiving worker's execution succeeded
     * @param durationMs time from the transfer to the end of that execution
     */
    public HandoffEvent settle(boolean success, long durationMs) {
        return new HandoffEvent(eventId, taskId, fromWorker, toWorker, reason, timestamp,
                success, Math.max(0L, durationMs), contextSizeBytes, true);
    }

    public String getEventId() {
        return eventId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getFromWorker() {
        return fromWorker;
    }

    public String getToWorker() {
        return toWorker;
    }

    public HandoffReason getReason() {
        return reason;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getContextSizeBytes() {
        return contextSizeBytes;
    }

    public boolean isSettled() {
        return settled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandoffEvent that = (HandoffEvent) o;
        return success == that.success
                && durationMs == that.durationMs
                && settled == that.settled
                && eventId.equals(that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, success, durationMs, settled);
    }

    @Override
    public String toString() {
        return "HandoffEvent{" +
                "taskId='" + taskId + '\'' +
                ", from='" + fromWorker + '\'' +
                ", to='" + toWorker + '\'' +
                ", reason=" + reason +
                ", success=" + success +
                ", settled=" + settled +
                ", durationMs=" + durationMs +
                ", contextSizeBytes=" + contextSizeBytes +
                '}';
    }
}
