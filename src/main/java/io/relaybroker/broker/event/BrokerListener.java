package io.relaybroker.broker.event;

/**
 * Receives broker events synchronously, on the thread that triggered them.
 * <p>
 * Implementations must not throw: the broker does not catch listener exceptions, so one
 * propagates to whoever called the operation that emitted the event.
 * </p>
 */
@FunctionalInterface
public interface BrokerListener {
    void onEvent(BrokerEvent event);
}
