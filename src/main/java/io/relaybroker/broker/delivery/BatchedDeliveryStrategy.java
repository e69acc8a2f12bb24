package io.relaybroker.broker.delivery;

import io.relaybroker.broker.event.BrokerEvent;
import io.relaybroker.broker.event.BrokerEventType;
import io.relaybroker.broker.Message;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Buffers messages and drains a topic once its queue reaches {@code batchSize}.
 * {@link #flush} drains regardless of size.
 */
@Slf4j
@Getter
public final class BatchedDeliveryStrategy implements DeliveryStrategy {
    public static final int DEFAULT_BATCH_SIZE = 3;

    private final int batchSize;

    public BatchedDeliveryStrategy() {
        this(DEFAULT_BATCH_SIZE);
    }

    public BatchedDeliveryStrategy(final int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        this.batchSize = batchSize;
    }

    @Override
    public void publish(final DeliveryContext context, final String topic, final Message message) {
        context.enqueue(topic, message);
        if (context.queueLength(topic) >= batchSize) {
            flush(context, topic);
        }
    }

    @Override
    public void flush(final DeliveryContext context, final String topic) {
        final int size = context.queueLength(topic);
        log.debug("Flushing {} queued message(s) on topic {}", size, topic);
        context.emit(BrokerEvent.of(BrokerEventType.BATCH_FLUSH, "topic", topic, "size", size));
        context.drain(topic);
    }

    @Override
    public String toString() {
        return name() + "(batchSize=" + batchSize + ")";
    }
}
