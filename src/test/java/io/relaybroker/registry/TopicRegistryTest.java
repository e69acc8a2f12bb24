package io.relaybroker.registry;

import io.relaybroker.broker.Message;
import io.relaybroker.subscriber.Subscriber;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TopicRegistryTest {

    @Test
    void declaredTopicsComeFirstInOrder() {
        final TopicRegistry registry = TopicRegistry.builder()
                .topic("orders/created")
                .topics(List.of("orders/cancelled", "orders/created"))
                .build();

        registry.getOrCreate("audit");

        assertEquals(List.of("orders/created", "orders/cancelled", "audit"), List.copyOf(registry.listTopics()));
        assertTrue(registry.contains("audit"));
        assertTrue(registry.find("missing").isEmpty());
    }

    @Test
    void getOrCreateIsIdempotent() {
        final TopicRegistry registry = new TopicRegistry();

        final TopicState first = registry.getOrCreate("t");
        final TopicState second = registry.getOrCreate("t");

        assertSame(first, second);
        assertEquals(1, registry.states().size());
    }

    @Test
    void topicQueueIsFifo() {
        final TopicState state = new TopicRegistry().getOrCreate("t");
        final Message a = new Message(1L, "t", "a", Instant.EPOCH);
        final Message b = new Message(2L, "t", "b", Instant.EPOCH);

        state.append(a);
        state.append(b);

        assertEquals(2, state.queueLength());
        assertEquals(List.of(a, b), state.pending());
        assertSame(a, state.poll());
        assertSame(b, state.poll());
        assertNull(state.poll());
    }

    @Test
    void summaryReflectsSubscribersAndQueue() {
        final TopicState state = new TopicRegistry().getOrCreate("t");
        state.addSubscriber(Subscriber.of("s", m -> { }));
        state.append(new Message(1L, "t", "a", Instant.EPOCH));
        state.getMetrics().recordPublished();

        assertEquals(1, state.summary().subscriberCount());
        assertEquals(1, state.summary().queueLength());
        assertEquals(1, state.summary().published());
        assertThrows(UnsupportedOperationException.class, () -> state.subscribers().clear());
    }
}
