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

package dev.mars.relay.core.exceptions;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Thrown when a task or worker is asked to move to a state that its state
 * machine does not allow from the current one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class InvalidTransitionException extends RelayException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;

    /**
     * @param entityId         the identifier of the entity whose transition was rejected
     * @param currentState     the current state of the entity
     * @param requestedState   the state that was requested but is not valid
     * @param validTransitions the states that are valid targets from the current state
     */
    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Collection<? extends Enum<?>> validTransitions) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                entityId, currentState, requestedState, formatTransitions(validTransitions)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    private static String formatTransitions(Collection<? extends Enum<?>> transitions) {
        if (transitions == null || transitions.isEmpty()) {
            return "[]";
        }
        return transitions.stream()
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
