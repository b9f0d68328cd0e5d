package com.swarmcore.core.events;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MessageRouterTest {

    private MessageRouter router;

    @BeforeEach
    void setUp() {
        router = new MessageRouter(2);
    }

    @AfterEach
    void tearDown() {
        router.shutdown(Duration.ofSeconds(1));
    }

    private static CoordinationEvent event(CoordinationEventType type, String taskId) {
        return CoordinationEvent.of(type, taskId, null, Map.of(), Instant.now());
    }

    // -- Delivery ------------------------------------------------------------

    @Nested
    @DisplayName("delivery")
    class DeliveryTests {

        @Test
        @DisplayName("each subscriber receives only its event types, in publish order")
        void filteredInOrder() {
            var completed = new CopyOnWriteArrayList<String>();
            var all = new CopyOnWriteArrayList<String>();
            router.subscribe("completed", Set.of(CoordinationEventType.TASK_COMPLETED), e -> completed.add(e.taskId()));
            router.subscribe("all", Set.of(), e -> all.add(e.taskId()));

            router.publish(event(CoordinationEventType.TASK_SUBMITTED, "a"));
            router.publish(event(CoordinationEventType.TASK_COMPLETED, "b"));

            assertTrue(router.flush(Duration.ofSeconds(2)));
            assertEquals(List.of("b"), completed);
            assertEquals(List.of("a", "b"), all);
        }

        @Test
        @DisplayName("a throwing subscriber does not stop delivery")
        void throwingSubscriber() {
            var seen = new CopyOnWriteArrayList<String>();
            router.subscribe("flaky", Set.of(), e -> {
                seen.add(e.taskId());
                throw new IllegalStateException("boom");
            });

            router.publish(event(CoordinationEventType.TASK_SUBMITTED, "a"));
            router.publish(event(CoordinationEventType.TASK_SUBMITTED, "b"));

            assertTrue(router.flush(Duration.ofSeconds(2)));
            assertEquals(List.of("a", "b"), seen);
        }

        @Test
        @DisplayName("unsubscribed consumer receives nothing further")
        void unsubscribe() {
            var seen = new CopyOnWriteArrayList<String>();
            MessageRouter.Subscription subscription = router.subscribe("s", Set.of(), e -> seen.add(e.taskId()));
            subscription.unsubscribe();

            router.publish(event(CoordinationEventType.TASK_SUBMITTED, "a"));
            assertTrue(router.flush(Duration.ofSeconds(1)));
            assertTrue(seen.isEmpty());
            assertEquals(0, router.subscriberCount());
        }
    }

    // -- Overflow ------------------------------------------------------------

    @Test
    @DisplayName("a slow subscriber drops its oldest queued events without blocking publishers")
    void dropOldest() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var seen = new CopyOnWriteArrayList<String>();
        router.subscribe("slow", Set.of(), e -> {
            seen.add(e.taskId());
            if ("e1".equals(e.taskId())) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        router.publish(event(CoordinationEventType.TASK_SUBMITTED, "e1"));
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        router.publish(event(CoordinationEventType.TASK_SUBMITTED, "e2"));
        router.publish(event(CoordinationEventType.TASK_SUBMITTED, "e3"));
        router.publish(event(CoordinationEventType.TASK_SUBMITTED, "e4"));

        assertEquals(1, router.totalDropped());
        release.countDown();
        assertTrue(router.flush(Duration.ofSeconds(2)));
        assertEquals(List.of("e1", "e3", "e4"), seen);
        SubscriberStats stats = router.stats().get(0);
        assertEquals(3, stats.delivered());
        assertEquals(1, stats.dropped());
    }

    @Test
    @DisplayName("after shutdown publishing is a no-op and subscribing fails")
    void afterShutdown() {
        router.shutdown(Duration.ofSeconds(1));
        router.publish(event(CoordinationEventType.TASK_SUBMITTED, "a"));
        assertThrows(IllegalStateException.class, () -> router.subscribe("late", Set.of(), e -> { }));
    }
}
