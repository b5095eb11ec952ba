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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TaskContext}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("TaskContext")
class TaskContextTest {

    private static TaskContext contextWithHistory(int entries) {
        TaskContext.Builder builder = new TaskContext.Builder()
                .sessionId("session-1")
                .userId("user-1")
                .task("Write the release notes");
        for (int i = 0; i < entries; i++) {
            builder.addConversationEntry(new ConversationEntry(i % 2 == 0 ? "user" : "assistant", "message " + i));
        }
        return builder.build();
    }

    @Test
    @DisplayName("Handoff context keeps only the most recent entries")
    void forHandoffTrimsHistory() {
        TaskContext original = contextWithHistory(15);
        HandoffReason reason = new HandoffReason(HandoffReasonType.PLANNED_TRANSITION, "coding done",
                HandoffSeverity.MINOR);

        TaskContext handedOff = original.forHandoff("coder-1", reason, 10);

        List<String> contents = handedOff.getConversationHistory().stream()
                .map(ConversationEntry::getContent)
                .collect(Collectors.toList());
        List<String> expected = IntStream.range(5, 15).mapToObj(i -> "message " + i).collect(Collectors.toList());
        assertEquals(expected, contents);
        assertEquals(15, original.getConversationHistory().size());
        assertEquals("session-1", handedOff.getSessionId());
        assertEquals(original.getTask(), handedOff.getTask());
    }

    @Test
    @DisplayName("Handoff context records where the task came from")
    void forHandoffAddsMetadata() {
        TaskContext original = contextWithHistory(2).withMetadata("ticket", "REL-12");
        HandoffReason reason = new HandoffReason(HandoffReasonType.CAPABILITY_MISMATCH, "needs tests", null);

        TaskContext handedOff = original.forHandoff("coder-1", reason, 10);

        assertEquals("REL-12", handedOff.getMetadata().get("ticket"));
        assertThat(handedOff.getMetadata().get(TaskContext.HANDOFF_METADATA_KEY))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("fromWorker", "coder-1")
                .containsEntry("reasonType", "capability_mismatch")
                .containsEntry("reason", "needs tests")
                .containsKey("transferTimestamp");
        assertEquals(2, handedOff.getConversationHistory().size());
    }

    @Test
    @DisplayName("Metadata and history cannot be modified from outside")
    void immutableCollections() {
        TaskContext context = contextWithHistory(1);
        assertThrows(UnsupportedOperationException.class, () -> context.getMetadata().put("x", 1));
        assertThrows(UnsupportedOperationException.class,
                () -> context.getConversationHistory().add(new ConversationEntry("user", "hi")));
    }

    @Test
    @DisplayName("Flags accept booleans and boolean strings")
    void flags() {
        TaskContext context = new TaskContext.Builder()
                .task("deploy")
                .putMetadata("requiresExecution", true)
                .putMetadata("dryRun", "true")
                .putMetadata("verbose", "no")
                .build();

        assertTrue(context.isFlagSet("requiresExecution"));
        assertTrue(context.isFlagSet("dryRun"));
        assertFalse(context.isFlagSet("verbose"));
        assertFalse(context.isFlagSet("missing"));
    }

    @Test
    @DisplayName("Serialises to JSON with ISO timestamps")
    void serialisesToJson() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        TaskContext context = contextWithHistory(3).withMetadata("attempt", 2);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsBytes(context));

        assertEquals("session-1", json.get("sessionId").asText());
        assertEquals("Write the release notes", json.get("task").asText());
        assertEquals(3, json.get("conversationHistory").size());
        assertEquals(2, json.get("metadata").get("attempt").asInt());
        assertTrue(json.has("timestamp"));
    }

    @Test
    @DisplayName("Worker results carry either output or error")
    void workerResults() {
        WorkerResult ok = WorkerResult.success("w1", Map.of("lines", 12));
        WorkerResult failed = WorkerResult.fromThrowable("w1", new IllegalStateException("disk full"));

        assertTrue(ok.isSuccess());
        assertNull(ok.getError());
        assertFalse(failed.isSuccess());
        assertThat(failed.getError()).contains("disk full");
    }
}
