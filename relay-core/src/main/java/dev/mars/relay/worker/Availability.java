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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Coordinator-side availability of a registered worker.
 *
 * <p>Workers never set this themselves. They emit {@link WorkerState} signals
 * and the coordinator decides what those mean for availability.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum Availability {

    /**
     * Eligible for selection.
     */
    AVAILABLE("available"),

    /**
     * Holding a task, or marked busy externally.
     */
    BUSY("busy"),

    /**
     * Unregistered or found unresponsive by the health monitor. Re-activated by the
     * next idle signal.
     */
    OFFLINE("offline");

    private static final Map<Availability, Set<Availability>> TRANSITIONS;

    static {
        var map = new EnumMap<Availability, Set<Availability>>(Availability.class);
        map.put(AVAILABLE, EnumSet.of(BUSY, OFFLINE));
        map.put(BUSY, EnumSet.of(AVAILABLE, OFFLINE));
        map.put(OFFLINE, EnumSet.of(AVAILABLE, BUSY));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    Availability(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(Availability target) {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet()).contains(target);
    }

    public Set<Availability> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    public static Availability fromValue(String value) {
        for (Availability availability : values()) {
            if (availability.value.equalsIgnoreCase(value) || availability.name().equalsIgnoreCase(value)) {
                return availability;
            }
        }
        throw new IllegalArgumentException("Unknown availability: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
