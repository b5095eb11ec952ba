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

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * A named value that handoff rule triggers compare against their thresholds.
 *
 * <p>Conditions are heuristics. Most of the built-in ones scan the task
 * description for domain words; they are deliberately narrow and can be replaced
 * per coordinator through {@link HandoffConditionRegistry#register(HandoffCondition)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class HandoffCondition {

    /**
     * Computes the value of a condition.
     */
    @FunctionalInterface
    public interface Evaluator {

        /**
         * @param context the task context
         * @param partialResult the result reported so far, or null if there is none
         * @return the condition value; boolean conditions use 1 and 0
         */
        double evaluate(TaskContext context, WorkerResult partialResult);
    }

    private final String name;
    private final Evaluator evaluator;
    private final HandoffReasonType reasonType;
    private final HandoffSeverity severity;

    public HandoffCondition(String name, Evaluator evaluator, HandoffReasonType reasonType, HandoffSeverity severity) {
        this.name = Objects.requireNonNull(name, "Condition name cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.reasonType = reasonType != null ? reasonType : HandoffReasonType.CAPABILITY_MISMATCH;
        this.severity = severity != null ? severity : HandoffSeverity.MODERATE;
    }

    /**
     * Boolean condition: 1 when the predicate holds, 0 otherwise.
     */
    public static HandoffCondition flag(String name, BiPredicate<TaskContext, WorkerResult> predicate,
                                        HandoffReasonType reasonType, HandoffSeverity severity) {
        return new HandoffCondition(name,
                (context, partial) -> predicate.test(context, partial) ? 1.0 : 0.0,
                reasonType, severity);
    }

    /**
     * Boolean condition that holds when the task description contains a match of {@code regex},
     * ignoring case.
     */
    public static HandoffCondition keywords(String name, String regex,
                                            HandoffReasonType reasonType, HandoffSeverity severity) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return flag(name, (context, partial) -> pattern.matcher(context.getTask()).find(), reasonType, severity);
    }

    public String getName() {
        return name;
    }

    public HandoffReasonType getReasonType() {
        return reasonType;
    }

    public HandoffSeverity getSeverity() {
        return severity;
    }

    public double evaluate(TaskContext context, WorkerResult partialResult) {
        return evaluator.evaluate(context, partialResult);
    }

    @Override
    public String toString() {
        return "HandoffCondition{" + name + ", " + reasonType.getValue() + "/" + severity.getValue() + '}';
    }
}
