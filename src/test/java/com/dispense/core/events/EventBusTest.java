package com.dispense.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static TaskEvent event(String type, String taskId) {
        return TaskEvent.of(type, taskId, Map.of());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversEventToTaskSubscriber() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribe("claude_1", received::add);

            var event = TaskEvent.of(TaskEvent.TYPE_STARTED, "claude_1", Map.of("pid", 42L));
            eventBus.publish(event);

            assertEquals(List.of(event), received);
            assertEquals(42L, received.get(0).payload().get("pid"));
        }

        @Test
        @DisplayName("does not deliver events of other tasks")
        void doesNotDeliverToOtherTask() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribe("claude_2", received::add);

            eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void deliversInOrder() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribe("claude_1", received::add);

            eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_1"));
            eventBus.publish(event(TaskEvent.TYPE_STOPPED, "claude_1"));
            eventBus.publish(event(TaskEvent.TYPE_FINALIZED, "claude_1"));

            assertEquals(List.of(TaskEvent.TYPE_STARTED, TaskEvent.TYPE_STOPPED, TaskEvent.TYPE_FINALIZED),
                    received.stream().map(TaskEvent::eventType).toList());
        }

        @Test
        @DisplayName("global subscriber sees every task")
        void globalSubscriberSeesAll() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_1"));
            eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_2"));

            assertEquals(List.of("claude_1", "claude_2"), received.stream().map(TaskEvent::taskId).toList());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery and drops empty subscriber lists")
        void unsubscribeStopsDelivery() {
            List<TaskEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("claude_1", received::add);
            assertEquals(1, eventBus.subscriberCount("claude_1"));

            subscription.unsubscribe();
            eventBus.publish(event(TaskEvent.TYPE_FINALIZED, "claude_1"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount("claude_1"));
        }

        @Test
        @DisplayName("unsubscribing one subscriber leaves the others")
        void unsubscribeDoesNotAffectOthers() {
            List<TaskEvent> first = new ArrayList<>();
            List<TaskEvent> second = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("claude_1", first::add);
            eventBus.subscribe("claude_1", second::add);

            subscription.unsubscribe();
            eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_1"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }
    }

    @Test
    @DisplayName("subscriber exception does not prevent delivery to others")
    void subscriberExceptionIsContained() {
        List<TaskEvent> received = new ArrayList<>();
        eventBus.subscribe("claude_1", e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribe("claude_1", received::add);

        assertDoesNotThrow(() -> eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_1")));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("handles concurrent publishes safely")
    void handlesConcurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<TaskEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe("claude_1", received::add);

        int threadCount = 10;
        int eventsPerThread = 100;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event(TaskEvent.TYPE_STARTED, "claude_1"));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }
}
