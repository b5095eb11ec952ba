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

import dev.mars.relay.core.HandoffReasonType;
import dev.mars.relay.core.HandoffSeverity;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named conditions available to handoff rule triggers.
 *
 * <p>A trigger naming a condition that is not registered never fires.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HandoffConditionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(HandoffConditionRegistry.class);

    public static final String IMPLEMENTATION_COMPLETE = "implementation_complete";
    public static final String IMPLEMENTATION_REQUIRED = "implementation_required";
    public static final String TEST_REQUIRED = "test_required";
    public static final String TOOL_REQUIRED = "tool_required";
    public static final String DEPLOY_REQUIRED = "deploy_required";
    public static final String COMMAND_EXECUTION = "command_execution";
    public static final String PLANNING_REQUIRED = "planning_required";
    public static final String PROJECT_PLAN = "project_plan";

    /** Metadata flag read by {@link #COMMAND_EXECUTION}. */
    public static final String REQUIRES_EXECUTION_KEY = "requiresExecution";

    private final Map<String, HandoffCondition> conditions = new ConcurrentHashMap<>();

    /**
     * Registry holding the built-in conditions.
     */
    public static HandoffConditionRegistry withDefaults() {
        HandoffConditionRegistry registry = new HandoffConditionRegistry();
        registry.register(HandoffCondition.flag(IMPLEMENTATION_COMPLETE,
                (context, partial) -> partial != null && partial.isSuccess(),
                HandoffReasonType.PLANNED_TRANSITION, HandoffSeverity.MINOR));
        registry.register(HandoffCondition.keywords(IMPLEMENTATION_REQUIRED,
                "\\b(implement\\w*|code|coding|develop\\w*|refactor\\w*)\\b",
                HandoffReasonType.EXPERTISE_REQUIRED, HandoffSeverity.MODERATE));
        registry.register(HandoffCondition.keywords(TEST_REQUIRED,
                "\\b(test|tests|testing|spec|specs|coverage)\\b",
                HandoffReasonType.CAPABILITY_MISMATCH, HandoffSeverity.MODERATE));
        registry.register(HandoffCondition.keywords(TOOL_REQUIRED,
                "\\b(run|execute|command|build|deploy|npm|git)\\b",
                HandoffReasonType.CAPABILITY_MISMATCH, HandoffSeverity.MODERATE));
        registry.register(HandoffCondition.keywords(DEPLOY_REQUIRED,
                "\\b(deploy\\w*|release|rollout|ship)\\b",
                HandoffReasonType.CAPABILITY_MISMATCH, HandoffSeverity.MAJOR));
        registry.register(HandoffCondition.flag(COMMAND_EXECUTION,
                (context, partial) -> context.isFlagSet(REQUIRES_EXECUTION_KEY),
                HandoffReasonType.CAPABILITY_MISMATCH, HandoffSeverity.MAJOR));
        registry.register(HandoffCondition.keywords(PLANNING_REQUIRED,
                "\\b(plan|plans|planning|roadmap|milestones?|schedule)\\b",
                HandoffReasonType.CAPABILITY_MISMATCH, HandoffSeverity.MODERATE));
        registry.register(HandoffCondition.keywords(PROJECT_PLAN,
                "\\b(project|sprint|release) plan\\b",
                HandoffReasonType.CAPABILITY_MISMATCH, HandoffSeverity.MODERATE));
        return registry;
    }

    /**
     * Add a condition, replacing any condition with the same name.
     */
    public void register(HandoffCondition condition) {
        Objects.requireNonNull(condition, "Condition cannot be null");
        HandoffCondition previous = conditions.put(condition.getName(), condition);
        if (previous != null) {
            logger.info("Handoff condition replaced: {}", condition.getName());
        }
    }

    public boolean unregister(String name) {
        return conditions.remove(name) != null;
    }

    public Optional<HandoffCondition> get(String name) {
        return Optional.ofNullable(conditions.get(name));
    }

    public boolean contains(String name) {
        return conditions.containsKey(name);
    }

    public Set<String> getNames() {
        return new TreeSet<>(conditions.keySet());
    }

    /**
     * Value of a condition, or empty when the name is unknown.
     */
    public OptionalDouble evaluate(String name, TaskContext context, WorkerResult partialResult) {
        HandoffCondition condition = conditions.get(name);
        if (condition == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(condition.evaluate(context, partialResult));
    }
}
