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

import dev.mars.relay.core.TaskRecord;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Queue of tasks waiting for a worker.
 *
 * <p>Two lanes make up the queue. The front lane holds tasks put back after a
 * failure or after losing their worker; the most recently returned task is first.
 * The ordered lane holds new submissions, ordered by {@link #ORDERING}. The front
 * lane is always drained before the ordered lane.</p>
 *
 * <p>The queue has its own lock, separate from the per-task locks.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class TaskQueue {

    /**
     * Higher priority first, then earlier deadline, tasks without a deadline after
     * those with one, then submission order.
     */
    public static final Comparator<TaskRecord> ORDERING = Comparator
            .comparingInt((TaskRecord task) -> -task.getPriority().getWeight())
            .thenComparing(task -> task.getDeadline().orElse(null),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(TaskRecord::getSubmissionSequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<TaskRecord> frontLane = new ArrayDeque<>();
    private final PriorityQueue<TaskRecord> orderedLane = new PriorityQueue<>(ORDERING);

    /**
     * Add a newly submitted task in priority order.
     */
    public void enqueue(TaskRecord task) {
        lock.lock();
        try {
            orderedLane.add(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a task ahead of everything else in the queue.
     */
    public void pushFront(TaskRecord task) {
        lock.lock();
        try {
            removeInternal(task.getTaskId());
            frontLane.addFirst(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tasks in the order the assignment loop should visit them.
     */
    public List<TaskRecord> inOrder() {
        lock.lock();
        try {
            List<TaskRecord> ordered = new ArrayList<>(frontLane.size() + orderedLane.size());
            ordered.addAll(frontLane);
            List<TaskRecord> rest = new ArrayList<>(orderedLane);
            rest.sort(ORDERING);
            ordered.addAll(rest);
            return ordered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a task, typically because the assignment loop committed it.
     *
     * @return true if the task was queued
     */
    public boolean remove(String taskId) {
        lock.lock();
        try {
            return removeInternal(taskId);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return frontLane.stream().anyMatch(task -> task.getTaskId().equals(taskId))
                    || orderedLane.stream().anyMatch(task -> task.getTaskId().equals(taskId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return frontLane.size() + orderedLane.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        lock.lock();
        try {
            frontLane.clear();
            orderedLane.clear();
        } finally {
            lock.unlock();
        }
    }

    private boolean removeInternal(String taskId) {
        boolean removed = frontLane.removeIf(task -> task.getTaskId().equals(taskId));
        return orderedLane.removeIf(task -> task.getTaskId().equals(taskId)) || removed;
    }
}
