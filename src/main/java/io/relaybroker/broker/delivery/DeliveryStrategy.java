package io.relaybroker.broker.delivery;

import io.relaybroker.broker.Message;

/**
 * Decides when queued messages are delivered. Strategies hold no per-topic state, so the
 * broker can swap them between publishes.
 */
public interface DeliveryStrategy {

    default String name() {
        return getClass().getSimpleName();
    }

    void publish(DeliveryContext context, String topic, Message message);

    /**
     * Forces delivery of whatever is queued for the topic. No-op unless the strategy buffers.
     */
    default void flush(final DeliveryContext context, final String topic) {
    }
}
