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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative rule that moves a task between worker types.
 *
 * <p>A rule applies when the current worker's type matches
 * {@link #getFromWorkerTypePattern()} and at least one of its triggers holds. The
 * target worker is then chosen among available workers whose type matches
 * {@link #getToWorkerTypePattern()}. Both patterns are regular expressions
 * matched against the whole type string. Rules with a lower {@link #getPriority()}
 * are evaluated first.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class HandoffRule {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("fromWorkerTypePattern")
    private final String fromWorkerTypePattern;

    @JsonProperty("toWorkerTypePattern")
    private final String toWorkerTypePattern;

    @JsonProperty("triggers")
    private final List<HandoffTrigger> triggers;

    @JsonProperty("priority")
    private final int priority;

    @JsonProperty("enabled")
    private final boolean enabled;

    private HandoffRule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Rule id cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.fromWorkerTypePattern = Objects.requireNonNull(builder.fromWorkerTypePattern,
                "From worker type pattern cannot be null");
        this.toWorkerTypePattern = Objects.requireNonNull(builder.toWorkerTypePattern,
                "To worker type pattern cannot be null");
        this.triggers = List.copyOf(builder.triggers);
        this.priority = builder.priority;
        this.enabled = builder.enabled;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getFromWorkerTypePattern() {
        return fromWorkerTypePattern;
    }

    public String getToWorkerTypePattern() {
        return toWorkerTypePattern;
    }

    public List<HandoffTrigger> getTriggers() {
        return triggers;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Copy of this rule with a different enabled flag.
     */
    public HandoffRule withEnabled(boolean enabled) {
        return new Builder(this).enabled(enabled).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandoffRule that = (HandoffRule) o;
        return priority == that.priority
                && enabled == that.enabled
                && id.equals(that.id)
                && name.equals(that.name)
                && fromWorkerTypePattern.equals(that.fromWorkerTypePattern)
                && toWorkerTypePattern.equals(that.toWorkerTypePattern)
                && triggers.equals(that.triggers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, fromWorkerTypePattern, toWorkerTypePattern, triggers, priority, enabled);
    }

    @Override
    public String toString() {
        return "HandoffRule{" +
                "id='" + id + '\'' +
                ", from='" + fromWorkerTypePattern + '\'' +
                ", to='" + toWorkerTypePattern + '\'' +
                ", triggers=" + triggers +
                ", priority=" + priority +
                ", enabled=" + enabled +
                '}';
    }

    /**
     * Builder for creating HandoffRule instances.
     */
    public static class Builder {
        private String id;
        private String name;
        private String fromWorkerTypePattern;
        private String toWorkerTypePattern;
        private final List<HandoffTrigger> triggers = new ArrayList<>();
        private int priority = 10;
        private boolean enabled = true;

        public Builder() {
        }

        public Builder(HandoffRule existing) {
            this.id = existing.id;
            this.name = existing.name;
            this.fromWorkerTypePattern = existing.fromWorkerTypePattern;
            this.toWorkerTypePattern = existing.toWorkerTypePattern;
            this.triggers.addAll(existing.triggers);
            this.priority = existing.priority;
            this.enabled = existing.enabled;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder from(String fromWorkerTypePattern) {
            this.fromWorkerTypePattern = fromWorkerTypePattern;
            return this;
        }

        public Builder to(String toWorkerTypePattern) {
            this.toWorkerTypePattern = toWorkerTypePattern;
            return this;
        }

        public Builder trigger(HandoffTrigger trigger) {
            this.triggers.add(trigger);
            return this;
        }

        public Builder trigger(String condition, ComparisonOperator operator, double threshold) {
            return trigger(new HandoffTrigger(condition, operator, threshold));
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public HandoffRule build() {
            return new HandoffRule(this);
        }
    }
}
