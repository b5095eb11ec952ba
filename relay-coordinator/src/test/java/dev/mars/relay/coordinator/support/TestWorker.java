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

package dev.mars.relay.coordinator.support;

import dev.mars.relay.core.TaskContext;
import dev.mars.relay.core.WorkerResult;
import dev.mars.relay.worker.Worker;
import dev.mars.relay.worker.WorkerSignals;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory worker whose executions are scripted by the test.
 *
 * <p>By default every execution succeeds immediately. Outcomes can be queued with
 * {@link #thenSucceed()}, {@link #thenFail()}, {@link #thenThrow()} and
 * {@link #thenHold()}; once the queue is empty the default outcome applies again.
 * Held executions stay pending until {@link #completeNext(boolean)} is called.</p>
 */
public class TestWorker implements Worker {

    public enum Outcome {
        SUCCEED, FAIL, THROW, HOLD
    }

    private final String workerId;
    private final String workerType;
    private final Set<String> capabilities;
    private final Deque<Outcome> script = new ArrayDeque<>();
    private final Deque<Held> held = new ArrayDeque<>();
    private final List<TaskContext> received = new CopyOnWriteArrayList<>();

    private volatile Outcome defaultOutcome = Outcome.SUCCEED;
    private volatile WorkerSignals signals;

    public TestWorker(String workerId, String workerType, String... capabilities) {
        this.workerId = workerId;
        this.workerType = workerType;
        this.capabilities = Collections.synchronizedSet(new LinkedHashSet<>(Arrays.asList(capabilities)));
    }

    public static TestWorker of(String workerId, String... capabilities) {
        return new TestWorker(workerId, "generic", capabilities);
    }

    @Override
    public String getWorkerId() {
        return workerId;
    }

    @Override
    public String getWorkerType() {
        return workerType;
    }

    @Override
    public Set<String> listCapabilities() {
        synchronized (capabilities) {
            return new LinkedHashSet<>(capabilities);
        }
    }

    @Override
    public void bind(WorkerSignals signals) {
        this.signals = signals;
    }

    @Override
    public Future<WorkerResult> execute(TaskContext context) {
        received.add(context);
        Outcome outcome;
        synchronized (script) {
            outcome = script.isEmpty() ? defaultOutcome : script.poll();
        }
        switch (outcome) {
            case FAIL:
                return Future.succeededFuture(WorkerResult.failure(workerId, "scripted failure"));
            case THROW:
                throw new IllegalStateException("scripted exception");
            case HOLD:
                Promise<WorkerResult> promise = Promise.promise();
                synchronized (held) {
                    held.add(new Held(context, promise));
                }
                return promise.future();
            default:
                return Future.succeededFuture(WorkerResult.success(workerId, "done: " + context.getTask()));
        }
    }

    public TestWorker thenSucceed() {
        return queue(Outcome.SUCCEED);
    }

    public TestWorker thenFail() {
        return queue(Outcome.FAIL);
    }

    public TestWorker thenThrow() {
        return queue(Outcome.THROW);
    }

    public TestWorker thenHold() {
        return queue(Outcome.HOLD);
    }

    public TestWorker byDefault(Outcome outcome) {
        this.defaultOutcome = outcome;
        return this;
    }

    private TestWorker queue(Outcome outcome) {
        synchronized (script) {
            script.add(outcome);
        }
        return this;
    }

    /**
     * Settle the oldest held execution.
     *
     * @return false if nothing was held
     */
    public boolean completeNext(boolean success) {
        Held next;
        synchronized (held) {
            next = held.poll();
        }
        if (next == null) {
            return false;
        }
        if (success) {
            next.promise.complete(WorkerResult.success(workerId, "done: " + next.context.getTask()));
        } else {
            next.promise.complete(WorkerResult.failure(workerId, "held execution failed"));
        }
        return true;
    }

    public int getHeldCount() {
        synchronized (held) {
            return held.size();
        }
    }

    public List<TaskContext> getReceived() {
        return List.copyOf(received);
    }

    public int getExecutionCount() {
        return received.size();
    }

    public WorkerSignals getSignals() {
        return signals;
    }

    public void addCapability(String capability) {
        capabilities.add(capability);
    }

    private static final class Held {
        private final TaskContext context;
        private final Promise<WorkerResult> promise;

        private Held(TaskContext context, Promise<WorkerResult> promise) {
            this.context = context;
            this.promise = promise;
        }
    }
}
