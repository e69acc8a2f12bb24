package io.relaybroker.subscriber;

import io.relaybroker.broker.Message;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A named handler bound to a topic. The name is used only for diagnostics and events.
 */
public record Subscriber(String name, DeliveryHandler handler) {

    public Subscriber {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
    }

    /**
     * Adapts a plain consumer: normal completion is a success and a {@link RuntimeException}
     * becomes a failure carrying the exception message.
     */
    public static Subscriber of(final String name, final Consumer<Message> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        return new Subscriber(name, message -> {
            try {
                consumer.accept(message);
                return DeliveryOutcome.success();
            } catch (final RuntimeException e) {
                return DeliveryOutcome.failure(e);
            }
        });
    }

    public DeliveryOutcome handle(final Message message) {
        return handler.handle(message);
    }
}
