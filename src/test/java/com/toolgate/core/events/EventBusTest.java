package com.toolgate.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

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

    private static GateEvent event(String type, String toolName) {
        return new GateEvent(type, toolName, "call-1", Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("Subscriptions")
    class SubscriptionTests {

        @Test
        @DisplayName("tool subscribers receive only their tool's events")
        void toolSubscription() {
            List<GateEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("bash", received::add);

            eventBus.publish(event(GateEvent.DECISION_EXECUTE, "bash"));
            eventBus.publish(event(GateEvent.DECISION_EXECUTE, "write_file"));

            assertEquals(1, received.size());
            assertEquals("bash", received.get(0).toolName());
        }

        @Test
        @DisplayName("global subscribers receive every event, including session-level ones")
        void globalSubscription() {
            List<GateEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(GateEvent.DECISION_SKIP, "bash"));
            eventBus.publish(event(GateEvent.MODE_CHANGED, null));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<GateEvent> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("bash", received::add);

            subscription.unsubscribe();
            eventBus.publish(event(GateEvent.GRANT_ISSUED, "bash"));

            assertTrue(received.isEmpty());
        }
    }

    @Test
    @DisplayName("a failing subscriber does not affect others or the publisher")
    void failingSubscriber() {
        List<GateEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event(GateEvent.POLICY_PERSISTED, "bash")));
        assertEquals(1, received.size());
    }
}
