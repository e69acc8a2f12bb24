package io.relaybroker.broker.delivery;

import io.relaybroker.broker.Message;

/**
 * Enqueues and drains the whole topic queue on every publish.
 */
public final class ImmediateDeliveryStrategy implements DeliveryStrategy {

    @Override
    public void publish(final DeliveryContext context, final String topic, final Message message) {
        context.enqueue(topic, message);
        context.drain(topic);
    }
}
