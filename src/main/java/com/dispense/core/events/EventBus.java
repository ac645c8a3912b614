package com.dispense.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for task lifecycle events.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TaskEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TaskEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(TaskEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        List<Consumer<TaskEvent>> subs = taskSubscribers.get(event.taskId());
        if (subs != null) {
            for (Consumer<TaskEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<TaskEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<TaskEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> taskSubscribers.computeIfPresent(taskId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<TaskEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    int subscriberCount(String taskId) {
        List<Consumer<TaskEvent>> subs = taskSubscribers.get(taskId);
        return subs == null ? 0 : subs.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TaskEvent> subscriber, TaskEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
