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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome reported by a worker for one execution of a task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class WorkerResult {

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("workerId")
    private final String workerId;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("output")
    private final Object output;

    @JsonProperty("metadata")
    private final Map<String, Object> metadata;

    private WorkerResult(boolean success, String workerId, Instant timestamp, String error,
                         Object output, Map<String, Object> metadata) {
        this.success = success;
        this.workerId = workerId;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.error = error;
        this.output = output;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public static WorkerResult success(String workerId, Object output) {
        return new WorkerResult(true, workerId, Instant.now(), null, output, null);
    }

    public static WorkerResult success(String workerId, Object output, Map<String, Object> metadata) {
        return new WorkerResult(true, workerId, Instant.now(), null, output, metadata);
    }

    public static WorkerResult failure(String workerId, String error) {
        return new WorkerResult(false, workerId, Instant.now(), error, null, null);
    }

    public static WorkerResult failure(String workerId, String error, Map<String, Object> metadata) {
        return new WorkerResult(false, workerId, Instant.now(), error, null, metadata);
    }

    /**
     * Build a failed result from an exception raised by, or on behalf of, a worker.
     */
    public static WorkerResult fromThrowable(String workerId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new WorkerResult(false, workerId, Instant.now(), message, null,
                Map.of("exception", cause.getClass().getName()));
    }

    public boolean isSuccess() {
        return success;
    }

    public String getWorkerId() {
        return workerId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public Object getOutput() {
        return output;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerResult that = (WorkerResult) o;
        return success == that.success
                && Objects.equals(workerId, that.workerId)
                && timestamp.equals(that.timestamp)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, workerId, timestamp, error);
    }

    @Override
    public String toString() {
        return "WorkerResult{" +
                "success=" + success +
                ", workerId='" + workerId + '\'' +
                ", timestamp=" + timestamp +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
