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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque payload handed to a worker together with a task.
 *
 * <p>The coordinator never interprets the context beyond two things: the handoff
 * rule conditions scan {@link #getTask()} and {@link #getMetadata()}, and a
 * handoff trims {@link #getConversationHistory()} to a bounded window before the
 * context moves to the next worker.</p>
 *
 * <p>Instances are immutable. Use {@link Builder} or one of the {@code with}
 * methods to derive a modified copy.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class TaskContext {

    /** Metadata key holding the handoff information attached by {@link #forHandoff}. */
    public static final String HANDOFF_METADATA_KEY = "handoff";

    @JsonProperty("sessionId")
    private final String sessionId;

    @JsonProperty("userId")
    private final String userId;

    @JsonProperty("task")
    private final String task;

    @JsonProperty("metadata")
    private final Map<String, Object> metadata;

    @JsonProperty("conversationHistory")
    private final List<ConversationEntry> conversationHistory;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    private TaskContext(Builder builder) {
        this.sessionId = builder.sessionId;
        this.userId = builder.userId;
        this.task = builder.task != null ? builder.task : "";
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.conversationHistory = List.copyOf(builder.conversationHistory);
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    /**
     * Shorthand for a context that only carries a task description.
     */
    public static TaskContext of(String task) {
        return new Builder().task(task).build();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Free-text description of the work.
     */
    public String getTask() {
        return task;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<ConversationEntry> getConversationHistory() {
        return conversationHistory;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Read a metadata flag. Accepts {@link Boolean} values and the strings
     * {@code "true"}/{@code "false"}.
     */
    public boolean isFlagSet(String key) {
        Object value = metadata.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * Derive the context that travels to the next worker on a handoff.
     * Only the last {@code historyWindow} conversation entries are kept and the
     * handoff details are recorded under {@link #HANDOFF_METADATA_KEY}.
     *
     * @param fromWorkerId the worker giving the task up
     * @param reason why the task is moving
     * @param historyWindow maximum number of conversation entries to keep
     * @return a new context for the receiving worker
     */
    public TaskContext forHandoff(String fromWorkerId, HandoffReason reason, int historyWindow) {
        List<ConversationEntry> trimmed = conversationHistory;
        if (historyWindow >= 0 && conversationHistory.size() > historyWindow) {
            trimmed = conversationHistory.subList(conversationHistory.size() - historyWindow,
                    conversationHistory.size());
        }

        Map<String, Object> handoff = new LinkedHashMap<>();
        handoff.put("fromWorker", fromWorkerId);
        handoff.put("reasonType", reason.getType().getValue());
        handoff.put("reason", reason.getDescription());
        handoff.put("transferTimestamp", Instant.now().toString());

        return new Builder(this)
                .conversationHistory(trimmed)
                .putMetadata(HANDOFF_METADATA_KEY, Collections.unmodifiableMap(handoff))
                .build();
    }

    public TaskContext withMetadata(String key, Object value) {
        return new Builder(this).putMetadata(key, value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskContext that = (TaskContext) o;
        return Objects.equals(sessionId, that.sessionId)
                && Objects.equals(userId, that.userId)
                && task.equals(that.task)
                && metadata.equals(that.metadata)
                && conversationHistory.equals(that.conversationHistory)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, userId, task, metadata, conversationHistory, timestamp);
    }

    @Override
    public String toString() {
        return "TaskContext{" +
                "sessionId='" + sessionId + '\'' +
                ", userId='" + userId + '\'' +
                ", task='" + task + '\'' +
                ", metadataKeys=" + metadata.keySet() +
                ", historySize=" + conversationHistory.size() +
                '}';
    }

    /**
     * Builder for creating TaskContext instances.
     */
    public static class Builder {
        private String sessionId;
        private String userId;
        private String task;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final List<ConversationEntry> conversationHistory = new ArrayList<>();
        private Instant timestamp;

        public Builder() {
        }

        public Builder(TaskContext existing) {
            this.sessionId = existing.sessionId;
            this.userId = existing.userId;
            this.task = existing.task;
            this.metadata.putAll(existing.metadata);
            this.conversationHistory.addAll(existing.conversationHistory);
            this.timestamp = existing.timestamp;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder task(String task) {
            this.task = task;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder conversationHistory(List<ConversationEntry> history) {
            this.conversationHistory.clear();
            if (history != null) {
                this.conversationHistory.addAll(history);
            }
            return this;
        }

        public Builder addConversationEntry(ConversationEntry entry) {
            this.conversationHistory.add(entry);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public TaskContext build() {
            return new TaskContext(this);
        }
    }
}
