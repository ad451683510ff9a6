package com.firmo.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
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

    private static FirmoEvent event(String type, String runId, String caseName) {
        return new FirmoEvent(type, runId, caseName, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events of the subscribed run only")
        void perRun() {
            List<FirmoEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", received::add);

            var mine = event(FirmoEvents.CASE_STARTED, "RUN-1", "A / x");
            eventBus.publish(mine);
            eventBus.publish(event(FirmoEvents.CASE_STARTED, "RUN-2", "A / x"));

            assertEquals(List.of(mine), received);
        }

        @Test
        @DisplayName("delivers to every subscriber of a run in publish order")
        void order() {
            List<FirmoEvent> first = new ArrayList<>();
            List<FirmoEvent> second = new ArrayList<>();
            eventBus.subscribe("RUN-1", first::add);
            eventBus.subscribe("RUN-1", second::add);

            eventBus.publish(event(FirmoEvents.RUN_STARTED, "RUN-1", null));
            eventBus.publish(event(FirmoEvents.RUN_FINISHED, "RUN-1", null));

            assertEquals(List.of(FirmoEvents.RUN_STARTED, FirmoEvents.RUN_FINISHED),
                    first.stream().map(FirmoEvent::eventType).toList());
            assertEquals(2, second.size());
        }

        @Test
        @DisplayName("global subscribers see every run")
        void global() {
            List<FirmoEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(FirmoEvents.RUN_STARTED, "RUN-1", null));
            eventBus.publish(event(FirmoEvents.RUN_STARTED, "RUN-2", null));

            assertEquals(List.of("RUN-1", "RUN-2"), received.stream().map(FirmoEvent::runId).toList());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery to that subscriber only")
        void unsubscribe() {
            List<FirmoEvent> dropped = new ArrayList<>();
            List<FirmoEvent> kept = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("RUN-1", dropped::add);
            eventBus.subscribe("RUN-1", kept::add);

            subscription.unsubscribe();
            eventBus.publish(event(FirmoEvents.CASE_FINISHED, "RUN-1", "x"));

            assertTrue(dropped.isEmpty());
            assertEquals(1, kept.size());
        }

        @Test
        @DisplayName("global subscriptions can be cancelled")
        void unsubscribeGlobal() {
            List<FirmoEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(event(FirmoEvents.RUN_STARTED, "RUN-1", null));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriber() {
            List<FirmoEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("RUN-1", received::add);

            eventBus.publish(event(FirmoEvents.CASE_STARTED, "RUN-1", "x"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("publishing with no subscribers is a no-op")
        void noSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event(FirmoEvents.RUN_STARTED, "RUN-1", null)));
        }

        @Test
        @DisplayName("concurrent publishes are all delivered")
        void concurrent() throws InterruptedException {
            CopyOnWriteArrayList<FirmoEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("RUN-1", received::add);
            int threads = 8;
            int perThread = 50;
            CountDownLatch latch = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(event(FirmoEvents.CASE_FINISHED, "RUN-1", "case " + i));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
