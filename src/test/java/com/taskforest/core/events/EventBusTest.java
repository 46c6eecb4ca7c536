package com.taskforest.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
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

    @Nested
    @DisplayName("HierarchyEvent")
    class HierarchyEventTests {

        @Test
        @DisplayName("creates event with all fields")
        void createsEventWithAllFields() {
            Instant now = Instant.now();
            var event = new HierarchyEvent("edge.accepted", "/ws", "C1", Map.of("parentId", "P"), now);

            assertEquals("edge.accepted", event.eventType());
            assertEquals("/ws", event.workspace());
            assertEquals("C1", event.taskId());
            assertEquals(Map.of("parentId", "P"), event.payload());
            assertEquals(now, event.timestamp());
        }

        @Test
        @DisplayName("null workspace and payload are normalised")
        void normalisesNulls() {
            var event = HierarchyEvent.of(HierarchyEvent.PASS_STARTED, null, null, null);
            assertEquals("", event.workspace());
            assertTrue(event.payload().isEmpty());
            assertNull(event.taskId());
        }

        @Test
        @DisplayName("payload tolerates null values and is read-only")
        void payloadCopy() {
            var payload = new HashMap<String, Object>();
            payload.put("parentId", null);
            var event = HierarchyEvent.of(HierarchyEvent.EDGE_REJECTED, "/ws", "C1", payload);
            payload.put("late", "x");

            assertTrue(event.payload().containsKey("parentId"));
            assertFalse(event.payload().containsKey("late"));
            assertThrows(UnsupportedOperationException.class, () -> event.payload().put("k", "v"));
        }
    }

    @Nested
    @DisplayName("listen and publish")
    class ListenAndPublishTests {

        @Test
        @DisplayName("a workspace listener sees only its own workspace")
        void workspaceListener() {
            List<HierarchyEvent> received = new ArrayList<>();
            eventBus.listen("/ws", received::add);

            var mine = HierarchyEvent.of("pass.started", "/ws", null, Map.of());
            eventBus.publish(mine);
            eventBus.publish(HierarchyEvent.of("pass.started", "/other", null, Map.of()));

            assertEquals(List.of(mine), received);
        }

        @Test
        @DisplayName("a null workspace selects shared-pass events")
        void sharedPassListener() {
            List<HierarchyEvent> received = new ArrayList<>();
            eventBus.listen(null, received::add);

            eventBus.publish(HierarchyEvent.of("pass.started", null, null, Map.of()));
            eventBus.publish(HierarchyEvent.of("pass.started", "/ws", null, Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("an unfiltered listener sees every workspace")
        void unfilteredListener() {
            List<HierarchyEvent> all = new ArrayList<>();
            eventBus.listen(all::add);

            eventBus.publish(HierarchyEvent.of("edge.accepted", "/ws", "C1", Map.of()));
            eventBus.publish(HierarchyEvent.of("edge.accepted", "/other", "C2", Map.of()));

            assertEquals(List.of("C1", "C2"), all.stream().map(HierarchyEvent::taskId).toList());
        }

        @Test
        @DisplayName("a throwing listener does not stop delivery to others")
        void throwingListenerIsolated() {
            List<HierarchyEvent> received = new ArrayList<>();
            eventBus.listen("/ws", e -> {
                throw new IllegalStateException("listener failure");
            });
            eventBus.listen("/ws", received::add);

            assertDoesNotThrow(() -> eventBus.publish(HierarchyEvent.of("pass.completed", "/ws", null, Map.of())));
            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("handles concurrent publishes from parallel passes")
    void handlesConcurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<HierarchyEvent> received = new CopyOnWriteArrayList<>();
        eventBus.listen(received::add);

        int threadCount = 8;
        int eventsPerThread = 100;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            final String workspace = "/ws" + t;
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(HierarchyEvent.of("edge.accepted", workspace, "T" + i, Map.of()));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }
}
