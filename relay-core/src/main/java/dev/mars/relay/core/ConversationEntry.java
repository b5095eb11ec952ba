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

/**
 * One turn of the conversation carried along with a task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ConversationEntry {

    @JsonProperty("role")
    private final String role;

    @JsonProperty("content")
    private final String content;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    public ConversationEntry(String role, String content, Instant timestamp) {
        this.role = Objects.requireNonNull(role, "Role cannot be null");
        this.content = content != null ? content : "";
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public ConversationEntry(String role, String content) {
        this(role, content, Instant.now());
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConversationEntry that = (ConversationEntry) o;
        return role.equals(that.role) && content.equals(that.content) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content, timestamp);
    }

    @Override
    public String toString() {
        return "ConversationEntry{role='" + role + "', content='" + content + "'}";
    }
}
