package com.verdict.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static VerdictEvent event(String type, String runId) {
        return new VerdictEvent(type, runId, "spec/cart_spec.java:4", Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events to subscribers of the run in subscription order")
        void deliversToRunSubscribers() {
            List<String> received = new ArrayList<>();
            eventBus.subscribe("VRDT-2026-0001", e -> received.add("first " + e.eventType()));
            eventBus.subscribe("VRDT-2026-0001", e -> received.add("second " + e.eventType()));

            eventBus.publish(event("example.started", "VRDT-2026-0001"));

            assertEquals(List.of("first example.started", "second example.started"), received);
        }

        @Test
        @DisplayName("does not deliver events of other runs")
        void ignoresOtherRuns() {
            List<VerdictEvent> received = new ArrayList<>();
            eventBus.subscribe("VRDT-2026-0001", received::add);

            eventBus.publish(event("example.started", "VRDT-2026-0002"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("publishing without subscribers is a no-op")
        void noSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event("run.started", "VRDT-2026-0003")));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery and forgets the run once its last consumer leaves")
        void stopsDelivery() {
            List<VerdictEvent> received = new ArrayList<>();
            var first = eventBus.subscribe("VRDT-2026-0001", received::add);
            var second = eventBus.subscribe("VRDT-2026-0001", received::add);

            first.unsubscribe();
            assertEquals(1, eventBus.subscriberCount("VRDT-2026-0001"));

            second.unsubscribe();
            eventBus.publish(event("run.finished", "VRDT-2026-0001"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount("VRDT-2026-0001"));
        }

        @Test
        @DisplayName("unsubscribing twice is harmless")
        void unsubscribeTwice() {
            var subscription = eventBus.subscribe("VRDT-2026-0001", e -> {});

            subscription.unsubscribe();

            assertDoesNotThrow(subscription::unsubscribe);
        }
    }

    @Test
    @DisplayName("a failing consumer does not stop delivery to the others")
    void failingConsumerIsIsolated() {
        List<VerdictEvent> received = new ArrayList<>();
        eventBus.subscribe("VRDT-2026-0001", event -> {
            throw new IllegalStateException("consumer broke");
        });
        eventBus.subscribe("VRDT-2026-0001", received::add);

        assertDoesNotThrow(() -> eventBus.publish(event("example.failed", "VRDT-2026-0001")));

        assertEquals(1, received.size());
    }
}
