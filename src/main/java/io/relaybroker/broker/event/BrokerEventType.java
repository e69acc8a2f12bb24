package io.relaybroker.broker.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle events emitted by the broker, with their stable wire names.
 */
@Getter
@RequiredArgsConstructor
public enum BrokerEventType {
    SUBSCRIBER_ADDED("subscriber_added"),
    MESSAGE_ENQUEUED("message_enqueued"),
    BACKPRESSURE("backpressure"),
    DELIVERING("delivering"),
    DELIVERED("delivered"),
    FAILED("failed"),
    RETRY_SCHEDULED("retry_scheduled"),
    DEAD_LETTER("dead_letter"),
    STRATEGY_SWAPPED("strategy_swapped"),
    BATCH_FLUSH("batch_flush");

    private final String wireName;
}
