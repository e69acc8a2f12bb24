package io.relaybroker.subscriber;

import io.relaybroker.broker.Message;

/**
 * Callback that consumes a message and reports whether it accepted it.
 */
@FunctionalInterface
public interface DeliveryHandler {
    DeliveryOutcome handle(Message message);
}
