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

import dev.mars.relay.core.ComparisonOperator;
import dev.mars.relay.core.HandoffReason;
import dev.mars.relay.core.HandoffReasonType;
import dev.mars.relay.core.HandoffRule;
import dev.mars.relay.core.HandoffSeverity;
import dev.mars.relay.core.HandoffTrigger;
import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.core.exceptions.InvalidHandoffRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Decides whether a task should move to another kind of worker.
 *
 * <p>Evaluation order:</p>
 * <ol>
 *   <li>the {@value #HANDOFF_TARGET_KEY} metadata entry of the task context, a worker type pattern;</li>
 *   <li>directive phrases in the task description such as "need testing" or "run command";</li>
 *   <li>enabled rules in ascending priority, where the current worker type must match the
 *       rule's from-pattern and at least one trigger must hold.</li>
 * </ol>
 * <p>A candidate whose target pattern already matches the current worker type is
 * skipped, so a task is never moved to a worker of the same kind by a rule.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class HandoffRuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(HandoffRuleEngine.class);

    /** Context metadata key naming the worker type a task should be handed to. */
    public static final String HANDOFF_TARGET_KEY = "handoffTarget";

    private static final List<Directive> DIRECTIVES = List.of(
            new Directive("hand\\s*off to coding", ".*coding.*", "Explicit request for a coding worker"),
            new Directive("need(s)? testing", ".*testing.*", "Explicit request for testing"),
            new Directive("run (a |the )?command", ".*tool.?execution.*", "Explicit request to run a command"),
            new Directive("create (a |the )?plan", ".*planning.*", "Explicit request for a plan"),
            new Directive("strategic analysis", ".*strategic.*", "Explicit request for strategic analysis"));

    private final HandoffConditionRegistry conditions;
    private final Map<String, CompiledRule> rules = new LinkedHashMap<>();
    private final AtomicLong insertionCounter = new AtomicLong();

    public HandoffRuleEngine(HandoffConditionRegistry conditions) {
        this.conditions = conditions != null ? conditions : HandoffConditionRegistry.withDefaults();
    }

    /**
     * The rules a coordinator starts with when default rules are enabled.
     */
    public static List<HandoffRule> defaultRules() {
        return List.of(
                new HandoffRule.Builder()
                        .id("strategic-to-coding")
                        .name("Strategic to Coding")
                        .from(".*strategic.*")
                        .to(".*coding.*")
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.IMPLEMENTATION_REQUIRED))
                        .priority(1)
                        .build(),
                new HandoffRule.Builder()
                        .id("coding-to-testing")
                        .name("Coding to Testing")
                        .from(".*coding.*")
                        .to(".*testing.*")
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.IMPLEMENTATION_COMPLETE))
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.TEST_REQUIRED))
                        .priority(2)
                        .build(),
                new HandoffRule.Builder()
                        .id("any-to-tool-execution")
                        .name("Any to Tool Execution")
                        .from(".*")
                        .to(".*tool.?execution.*")
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.TOOL_REQUIRED))
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.COMMAND_EXECUTION))
                        .priority(3)
                        .build(),
                new HandoffRule.Builder()
                        .id("any-to-planning")
                        .name("Any to Planning")
                        .from(".*")
                        .to(".*planning.*")
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.PLANNING_REQUIRED))
                        .trigger(HandoffTrigger.whenTrue(HandoffConditionRegistry.PROJECT_PLAN))
                        .priority(4)
                        .build());
    }

    public void installDefaultRules() {
        for (HandoffRule rule : defaultRules()) {
            try {
                addRule(rule);
            } catch (InvalidHandoffRuleException e) {
                throw new IllegalStateException("Built-in handoff rule is invalid: " + rule.getId(), e);
            }
        }
    }

    public HandoffConditionRegistry getConditions() {
        return conditions;
    }

    // ==================== Rule management ====================

    /**
     * Add a rule, replacing any rule with the same id.
     *
     * @throws InvalidHandoffRuleException if a pattern does not compile, the rule has no
     *                                     triggers or a threshold is not a number
     */
    public void addRule(HandoffRule rule) throws InvalidHandoffRuleException {
        if (rule == null) {
            throw new InvalidHandoffRuleException(null, "Rule cannot be null");
        }
        String id = rule.getId();
        if (id.isBlank()) {
            throw new InvalidHandoffRuleException(id, "Rule id cannot be blank");
        }
        if (rule.getTriggers().isEmpty()) {
            throw new InvalidHandoffRuleException(id, "Rule needs at least one trigger");
        }
        for (HandoffTrigger trigger : rule.getTriggers()) {
            if (Double.isNaN(trigger.getThreshold())) {
                throw new InvalidHandoffRuleException(id, "Threshold of " + trigger.getCondition() + " is not a number");
            }
            if (!conditions.contains(trigger.getCondition())) {
                logger.warn("Handoff rule {} uses unknown condition '{}', that trigger will never fire",
                        id, trigger.getCondition());
            }
        }
        Pattern from = compile(id, "from", rule.getFromWorkerTypePattern());
        Pattern to = compile(id, "to", rule.getToWorkerTypePattern());

        synchronized (rules) {
            CompiledRule previous = rules.get(id);
            long order = previous != null ? previous.order : insertionCounter.incrementAndGet();
            rules.put(id, new CompiledRule(rule, from, to, order));
            if (previous != null) {
                logger.info("Handoff rule replaced: {}", id);
            } else {
                logger.info("Handoff rule added: {} ({} -> {}, priority {})", id,
                        rule.getFromWorkerTypePattern(), rule.getToWorkerTypePattern(), rule.getPriority());
            }
        }
    }

    public boolean removeRule(String ruleId) {
        synchronized (rules) {
            boolean removed = rules.remove(ruleId) != null;
            if (removed) {
                logger.info("Handoff rule removed: {}", ruleId);
            }
            return removed;
        }
    }

    /**
     * Enable or disable a rule.
     *
     * @return false if there is no rule with that id
     */
    public boolean setRuleEnabled(String ruleId, boolean enabled) {
        synchronized (rules) {
            CompiledRule existing = rules.get(ruleId);
            if (existing == null) {
                return false;
            }
            rules.put(ruleId, existing.withRule(existing.rule.withEnabled(enabled)));
            logger.info("Handoff rule {} {}", ruleId, enabled ? "enabled" : "disabled");
            return true;
        }
    }

    public Optional<HandoffRule> getRule(String ruleId) {
        synchronized (rules) {
            CompiledRule compiled = rules.get(ruleId);
            return compiled != null ? Optional.of(compiled.rule) : Optional.empty();
        }
    }

    /**
     * All rules in evaluation order.
     */
    public List<HandoffRule> getRules() {
        return ordered().stream().map(compiled -> compiled.rule).collect(Collectors.toList());
    }

    // ==================== Evaluation ====================

    /**
     * Decide whether the task described by {@code context} should leave a worker of
     * type {@code workerType}.
     *
     * @param context the task context
     * @param workerType type of the worker that holds, or is about to hold, the task
     * @param partialResult what the worker has reported so far, may be null
     * @return the decision, or empty when the task should stay
     */
    public Optional<HandoffDecision> evaluate(TaskContext context, String workerType, WorkerResult partialResult) {
        if (context == null) {
            return Optional.empty();
        }
        String currentType = workerType != null ? workerType : "";

        Optional<HandoffDecision> directive = explicitTarget(context, currentType);
        if (directive.isPresent()) {
            return directive;
        }
        directive = keywordDirective(context, currentType);
        if (directive.isPresent()) {
            return directive;
        }

        for (CompiledRule compiled : ordered()) {
            if (!compiled.rule.isEnabled() || !compiled.from.matcher(currentType).matches()) {
                continue;
            }
            if (compiled.to.matcher(currentType).matches()) {
                continue;
            }
            Optional<HandoffTrigger> fired = firstFiring(compiled.rule, context, partialResult);
            if (fired.isPresent()) {
                HandoffReason reason = reasonFor(compiled.rule, fired.get());
                logger.debug("Handoff rule {} fired for worker type {} on {}", compiled.rule.getId(),
                        currentType, fired.get().getCondition());
                return Optional.of(new HandoffDecision(compiled.rule.getId(), compiled.to, reason));
            }
        }
        return Optional.empty();
    }

    private Optional<HandoffDecision> explicitTarget(TaskContext context, String currentType) {
        Object value = context.getMetadata().get(HANDOFF_TARGET_KEY);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        Pattern target;
        try {
            target = Pattern.compile(value.toString(), Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            logger.warn("Ignoring invalid {} '{}': {}", HANDOFF_TARGET_KEY, value, e.getDescription());
            return Optional.empty();
        }
        if (target.matcher(currentType).matches()) {
            return Optional.empty();
        }
        return Optional.of(new HandoffDecision(null, target, new HandoffReason(HandoffReasonType.EXPERTISE_REQUIRED,
                "Task asked for a worker of type " + value, HandoffSeverity.MODERATE)));
    }

    private Optional<HandoffDecision> keywordDirective(TaskContext context, String currentType) {
        for (Directive directive : DIRECTIVES) {
            if (directive.phrase.matcher(context.getTask()).find()
                    && !directive.target.matcher(currentType).matches()) {
                return Optional.of(new HandoffDecision(null, directive.target, new HandoffReason(
                        HandoffReasonType.CAPABILITY_MISMATCH, directive.description, HandoffSeverity.MODERATE)));
            }
        }
        return Optional.empty();
    }

    private Optional<HandoffTrigger> firstFiring(HandoffRule rule, TaskContext context, WorkerResult partialResult) {
        for (HandoffTrigger trigger : rule.getTriggers()) {
            OptionalDouble value;
            try {
                value = conditions.evaluate(trigger.getCondition(), context, partialResult);
            } catch (RuntimeException e) {
                logger.warn("Condition {} of rule {} failed, treating it as not met", trigger.getCondition(),
                        rule.getId(), e);
                continue;
            }
            if (value.isPresent() && trigger.getOperator().test(value.getAsDouble(), trigger.getThreshold())) {
                return Optional.of(trigger);
            }
        }
        return Optional.empty();
    }

    private HandoffReason reasonFor(HandoffRule rule, HandoffTrigger trigger) {
        HandoffReasonType type = HandoffReasonType.CAPABILITY_MISMATCH;
        HandoffSeverity severity = HandoffSeverity.MODERATE;
        Optional<HandoffCondition> condition = conditions.get(trigger.getCondition());
        if (condition.isPresent()) {
            type = condition.get().getReasonType();
            severity = condition.get().getSeverity();
        }
        String operator = trigger.getOperator() == ComparisonOperator.EQ && trigger.getThreshold() == 1.0
                ? "" : " " + trigger.getOperator().getValue() + " " + trigger.getThreshold();
        return new HandoffReason(type, rule.getName() + ": " + trigger.getCondition() + operator, severity);
    }

    private List<CompiledRule> ordered() {
        synchronized (rules) {
            return rules.values().stream()
                    .sorted(Comparator.comparingInt((CompiledRule c) -> c.rule.getPriority())
                            .thenComparingLong(c -> c.order))
                    .collect(Collectors.toList());
        }
    }

    private static Pattern compile(String ruleId, String side, String regex) throws InvalidHandoffRuleException {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new InvalidHandoffRuleException(ruleId,
                    "Invalid " + side + " worker type pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    private static final class CompiledRule {
        private final HandoffRule rule;
        private final Pattern from;
        private final Pattern to;
        private final long order;

        private CompiledRule(HandoffRule rule, Pattern from, Pattern to, long order) {
            this.rule = rule;
            this.from = from;
            this.to = to;
            this.order = order;
        }

        private CompiledRule withRule(HandoffRule updated) {
            return new CompiledRule(updated, from, to, order);
        }
    }

    private static final class Directive {
        private final Pattern phrase;
        private final Pattern target;
        private final String description;

        private Directive(String phrase, String target, String description) {
            this.phrase = Pattern.compile(phrase, Pattern.CASE_INSENSITIVE);
            this.target = Pattern.compile(target, Pattern.CASE_INSENSITIVE);
            this.description = description;
        }
    }
}
