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

package dev.mars.relay.coordinator.service;

import dev.mars.relay.worker.WorkerPerformance;
import dev.mars.relay.worker.WorkerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the best worker for a set of required capabilities.
 *
 * <p>Scoring blends how many required capabilities a worker covers with how well it
 * has performed so far; see {@link SelectionWeights} for the formula. A capability
 * matches a requirement when it contains the requirement, ignoring case, so a
 * worker offering {@code "coding"} satisfies {@code "code"}. A task with no
 * requirements is matched by every available worker with a capability score of
 * {@code 1.0}.</p>
 *
 * <p>The service holds no state of its own and only reads the registrations it is
 * given. It never reserves a worker; callers commit the choice with
 * {@link WorkerRegistration#tryReserve(String)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkerSelectionService {

    private static final Logger logger = LoggerFactory.getLogger(WorkerSelectionService.class);

    private final SelectionWeights weights;

    public WorkerSelectionService() {
        this(SelectionWeights.DEFAULTS);
    }

    public WorkerSelectionService(SelectionWeights weights) {
        this.weights = Objects.requireNonNull(weights, "Selection weights cannot be null");
    }

    public SelectionWeights getWeights() {
        return weights;
    }

    /**
     * Select the best available worker.
     *
     * @param requiredCapabilities what the task needs
     * @param candidates registrations to consider, in registration order
     * @return the highest scoring available worker, if its score is above zero
     */
    public Optional<WorkerRegistration> selectWorker(Set<String> requiredCapabilities,
                                                     Collection<WorkerRegistration> candidates) {
        return selectWorker(requiredCapabilities, candidates, Collections.emptySet());
    }

    /**
     * Select the best available worker, skipping the given ids.
     * Ties keep the earlier candidate.
     *
     * @param requiredCapabilities what the task needs
     * @param candidates registrations to consider, in registration order
     * @param excludedWorkerIds ids that may not be chosen
     * @return the highest scoring available worker, if its score is above zero
     */
    public Optional<WorkerRegistration> selectWorker(Set<String> requiredCapabilities,
                                                     Collection<WorkerRegistration> candidates,
                                                     Set<String> excludedWorkerIds) {
        Set<String> required = requiredCapabilities != null ? requiredCapabilities : Collections.emptySet();
        Set<String> excluded = excludedWorkerIds != null ? excludedWorkerIds : Collections.emptySet();

        WorkerRegistration best = null;
        double bestScore = 0.0;
        for (WorkerRegistration candidate : candidates) {
            if (!candidate.isAvailable() || excluded.contains(candidate.getWorkerId())) {
                continue;
            }
            double score = totalScore(required, candidate.getCapabilities(), candidate.getPerformance());
            if (logger.isTraceEnabled()) {
                logger.trace("Candidate {} scored {} for {}", candidate.getWorkerId(), score, required);
            }
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best == null) {
            logger.debug("No available worker scored above zero for {}", required);
            return Optional.empty();
        }
        logger.debug("Selected worker {} (score {}) for {}", best.getWorkerId(),
                String.format("%.3f", bestScore), required);
        return Optional.of(best);
    }

    /**
     * Fraction of required capabilities the worker covers; {@code 1.0} when nothing is required.
     */
    public double capabilityScore(Set<String> requiredCapabilities, Set<String> workerCapabilities) {
        if (requiredCapabilities == null || requiredCapabilities.isEmpty()) {
            return 1.0;
        }
        if (workerCapabilities == null || workerCapabilities.isEmpty()) {
            return 0.0;
        }
        long matched = requiredCapabilities.stream()
                .filter(required -> covers(workerCapabilities, required))
                .count();
        return (double) matched / requiredCapabilities.size();
    }

    /**
     * Blend of success rate and speed relative to the reference latency. A worker with
     * no recorded response time gets the full speed contribution.
     */
    public double performanceScore(WorkerPerformance performance) {
        double averageMs = performance.getAverageResponseTimeMs();
        double speed = averageMs <= 0.0
                ? 1.0
                : Math.min(1.0, weights.getReferenceLatencyMs() / averageMs);
        return performance.getSuccessRate() * weights.getSuccessRateWeight()
                + speed * weights.getResponseTimeWeight();
    }

    public double totalScore(Set<String> requiredCapabilities, Set<String> workerCapabilities,
                             WorkerPerformance performance) {
        return capabilityScore(requiredCapabilities, workerCapabilities) * weights.getCapabilityWeight()
                + performanceScore(performance) * weights.getPerformanceWeight();
    }

    private static boolean covers(Set<String> workerCapabilities, String required) {
        String needle = required.toLowerCase(Locale.ROOT);
        for (String capability : workerCapabilities) {
            if (capability.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
