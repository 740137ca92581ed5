package com.switchyard.core.events;

import com.switchyard.core.events.SwitchyardEvent.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static SwitchyardEvent event(Type type, String name) {
        return SwitchyardEvent.of(type, "id-" + name, name, Map.of(), CLOCK);
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("typed subscribers receive only their kind")
        void typedSubscription() {
            List<SwitchyardEvent> merges = new ArrayList<>();
            eventBus.subscribe(Type.MERGE_COMPLETED, merges::add);

            eventBus.publish(event(Type.SESSION_ADDED, "alpha"));
            var merged = event(Type.MERGE_COMPLETED, "alpha");
            eventBus.publish(merged);

            assertEquals(List.of(merged), merges);
        }

        @Test
        @DisplayName("global subscribers receive every event in order")
        void globalSubscribersReceiveAll() {
            List<Type> types = new ArrayList<>();
            eventBus.subscribeAll(e -> types.add(e.type()));

            eventBus.publish(event(Type.SESSION_ADDED, "alpha"));
            eventBus.publish(event(Type.STATE_CHANGED, "beta"));

            assertEquals(List.of(Type.SESSION_ADDED, Type.STATE_CHANGED), types);
        }

        @Test
        @DisplayName("events are stamped by the given clock and keep a copy of the payload")
        void timestampAndPayload() {
            Map<String, Object> payload = new HashMap<>(Map.of("to", "running"));
            var event = SwitchyardEvent.of(Type.STATE_CHANGED, "s1", "alpha", payload, CLOCK);
            payload.put("to", "spec");

            assertEquals(NOW, event.timestamp());
            assertEquals("running", event.payload().get("to"));
            assertEquals("session.state_changed", event.type().wireName());
        }
    }

    @Nested
    @DisplayName("unsubscribe and isolation")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribed consumer stops receiving events")
        void unsubscribeStopsDelivery() {
            List<SwitchyardEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe(Type.SESSION_REMOVED, received::add);
            subscription.unsubscribe();

            eventBus.publish(event(Type.SESSION_REMOVED, "alpha"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void failingSubscriberIsIsolated() {
            List<SwitchyardEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(Type.GIT_STATS_UPDATED, "alpha")));
            assertEquals(1, received.size());
        }
    }
}
