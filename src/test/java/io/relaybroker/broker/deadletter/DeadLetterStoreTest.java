package io.relaybroker.broker.deadletter;

import io.relaybroker.broker.Message;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DeadLetterStoreTest {

    private static DeadLetter entry(final long id, final String topic) {
        return new DeadLetter(new Message(id, topic, "p" + id, Instant.EPOCH), Map.of("sink", "boom"), Instant.EPOCH);
    }

    @Test
    void keepsEntriesInArrivalOrder() {
        final DeadLetterStore store = new DeadLetterStore();
        store.add(entry(1, "a"));
        store.add(entry(2, "b"));
        store.add(entry(3, "a"));

        assertEquals(3, store.size());
        assertEquals(List.of(1L, 2L, 3L), store.entries().stream().map(DeadLetter::messageId).toList());
        assertEquals(List.of(1L, 3L), store.forTopic("a").stream().map(DeadLetter::messageId).toList());
        assertEquals(3, store.messages().size());
        assertTrue(store.contains(2));
        assertFalse(store.contains(4));
    }

    @Test
    void snapshotsAreReadOnlyAndDetached() {
        final DeadLetterStore store = new DeadLetterStore();
        store.add(entry(1, "a"));

        final List<DeadLetter> snapshot = store.entries();
        store.add(entry(2, "a"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(entry(9, "a")));
        assertThrows(UnsupportedOperationException.class, () -> store.messages().clear());
    }

    @Test
    void entryCopiesFailedSubscribers() {
        final DeadLetter dl = entry(5, "orders");

        assertEquals("orders", dl.topic());
        assertThrows(UnsupportedOperationException.class, () -> dl.failedSubscribers().add("other"));
        assertThrows(UnsupportedOperationException.class, () -> dl.errors().put("other", "x"));
        assertThrows(NullPointerException.class, () -> new DeadLetterStore().add(null));
    }

    @Test
    void keepsLastErrorPerSubscriberInTargetOrder() {
        final Map<String, String> errors = new LinkedHashMap<>();
        errors.put("b", "timeout");
        errors.put("a", "refused");
        final DeadLetter dl = new DeadLetter(new Message(1, "t", "p", Instant.EPOCH), errors, Instant.EPOCH);
        errors.put("c", "late");

        assertEquals(List.of("b", "a"), dl.failedSubscribers());
        assertEquals("timeout", dl.error("b"));
        assertEquals("refused", dl.error("a"));
        assertNull(dl.error("c"), "entry is detached from the caller's map");
    }
}
