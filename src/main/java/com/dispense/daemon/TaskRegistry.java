package com.dispense.daemon;

import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory map of tasks guarded by a single lock. Readers always get a snapshot taken
 * under the lock, so a status never mixes fields from before and after a transition.
 */
public class TaskRegistry {

    private static final Comparator<Task> NEWEST_FIRST =
            Comparator.comparing(Task::startedAt).thenComparing(Task::id).reversed();

    private final Map<String, Task> tasks = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    void register(Task task) {
        lock.lock();
        try {
            tasks.put(task.id(), task);
        } finally {
            lock.unlock();
        }
    }

    /** Runs {@code action} on the task under the lock; empty when the id is unknown. */
    <T> Optional<T> withTask(String taskId, Function<Task, T> action) {
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            return task == null ? Optional.empty() : Optional.ofNullable(action.apply(task));
        } finally {
            lock.unlock();
        }
    }

    Optional<Task> find(String taskId) {
        return withTask(taskId, Function.identity());
    }

    public Optional<TaskStatus> status(String taskId) {
        return withTask(taskId, Task::toStatus);
    }

    /** Status of the most recently started task, or the idle sentinel. */
    public TaskStatus latestStatus() {
        lock.lock();
        try {
            return tasks.values().stream()
                    .min(NEWEST_FIRST)
                    .map(Task::toStatus)
                    .orElseGet(TaskStatus::idle);
        } finally {
            lock.unlock();
        }
    }

    /** Tasks newest first, optionally restricted to one state. */
    public List<TaskInfo> list(TaskState filter) {
        lock.lock();
        try {
            return tasks.values().stream()
                    .filter(t -> filter == null || t.state() == filter)
                    .sorted(NEWEST_FIRST)
                    .map(Task::toInfo)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    List<Task> active() {
        lock.lock();
        try {
            return tasks.values().stream().filter(t -> !t.state().isTerminal()).toList();
        } finally {
            lock.unlock();
        }
    }

    /** Removes a finished task. Returns empty when unknown, throws when still active. */
    Optional<Task> removeFinished(String taskId) {
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return Optional.empty();
            }
            if (!task.state().isTerminal()) {
                throw new IllegalStateException("Task " + taskId + " is still " + task.state());
            }
            tasks.remove(taskId);
            return Optional.of(task);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }
}
