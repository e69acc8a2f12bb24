package io.relaybroker.broker.delivery;

import io.relaybroker.broker.event.BrokerEvent;
import io.relaybroker.broker.Message;

/**
 * The slice of the broker a {@link DeliveryStrategy} may drive.
 */
public interface DeliveryContext {

    /**
     * Appends the message to the topic queue, or drops it with a backpressure event when the
     * queue is full.
     *
     * @return {@code true} if the message was queued
     */
    boolean enqueue(String topic, Message message);

    int queueLength(String topic);

    /**
     * Delivers queued messages of the topic until its queue is empty, retries included.
     */
    void drain(String topic);

    void emit(BrokerEvent event);
}
