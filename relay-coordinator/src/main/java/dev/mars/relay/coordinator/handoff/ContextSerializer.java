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

package dev.mars.relay.coordinator.handoff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.relay.core.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of the context that travels with a handoff. Only the size is recorded on
 * the handoff event.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ContextSerializer {

    private static final Logger logger = LoggerFactory.getLogger(ContextSerializer.class);

    private final ObjectMapper objectMapper;

    public ContextSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public byte[] serialize(TaskContext context) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(context);
    }

    /**
     * Size of the serialised context in bytes, or {@code -1} if it cannot be serialised.
     */
    public long sizeOf(TaskContext context) {
        if (context == null) {
            return 0L;
        }
        try {
            return serialize(context).length;
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialise context of session {} for size accounting: {}",
                    context.getSessionId(), e.getOriginalMessage());
            return -1L;
        }
    }
}
