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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans coordinator events out to the registered listeners.
 *
 * <p>A listener that throws is logged and skipped; the remaining listeners still
 * receive the event and the publishing component carries on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final List<CoordinatorEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(CoordinatorEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public boolean removeListener(CoordinatorEventListener listener) {
        return listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void publish(CoordinatorEvent event) {
        logger.debug("Publishing {}", event);
        for (CoordinatorEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.error("Listener {} failed on {}", listener, event.getClass().getSimpleName(), e);
            }
        }
    }
}
