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

package dev.mars.relay.coordinator.event;

import dev.mars.relay.core.TaskPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventPublisher")
class EventPublisherTest {

    private static CoordinatorEvent submitted(String taskId) {
        return new CoordinatorEvent.TaskSubmitted(taskId, TaskPriority.MEDIUM, Set.of(), Instant.now());
    }

    @Test
    @DisplayName("Listeners receive events in registration order")
    void deliversInOrder() {
        EventPublisher publisher = new EventPublisher();
        List<String> seen = new ArrayList<>();
        publisher.addListener(event -> seen.add("first:" + ((CoordinatorEvent.TaskSubmitted) event).taskId()));
        publisher.addListener(event -> seen.add("second:" + ((CoordinatorEvent.TaskSubmitted) event).taskId()));

        publisher.publish(submitted("t1"));

        assertEquals(List.of("first:t1", "second:t1"), seen);
    }

    @Test
    @DisplayName("A failing listener does not stop delivery to the others")
    void failingListenerIsolated() {
        EventPublisher publisher = new EventPublisher();
        List<CoordinatorEvent> seen = new ArrayList<>();
        publisher.addListener(event -> {
            throw new IllegalStateException("listener broke");
        });
        publisher.addListener(seen::add);

        assertDoesNotThrow(() -> publisher.publish(submitted("t1")));
        assertEquals(1, seen.size());
    }

    @Test
    @DisplayName("Removed listeners stop receiving events")
    void removeListener() {
        EventPublisher publisher = new EventPublisher();
        List<CoordinatorEvent> seen = new ArrayList<>();
        CoordinatorEventListener listener = seen::add;
        publisher.addListener(listener);

        assertTrue(publisher.removeListener(listener));
        assertFalse(publisher.removeListener(listener));
        publisher.publish(submitted("t1"));

        assertTrue(seen.isEmpty());
        assertEquals(0, publisher.getListenerCount());
    }

    @Test
    @DisplayName("Events reject missing identifiers")
    void eventValidation() {
        assertThrows(NullPointerException.class,
                () -> new CoordinatorEvent.TaskAssigned(null, "W1", Instant.now()));
    }
}
