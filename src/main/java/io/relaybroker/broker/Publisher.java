package io.relaybroker.broker;

import lombok.Getter;

import java.util.Objects;

/**
 * Thin publishing facade over a {@link Broker}, optionally bound to a default topic.
 */
public final class Publisher {
    @Getter
    private final Broker broker;
    private final String defaultTopic;

    public Publisher(final Broker broker) {
        this(broker, null);
    }

    private Publisher(final Broker broker, final String defaultTopic) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.defaultTopic = defaultTopic;
    }

    public static Publisher forTopic(final Broker broker, final String topic) {
        return new Publisher(broker, Objects.requireNonNull(topic, "topic"));
    }

    public Message publish(final String topic, final Object payload) {
        return broker.publish(topic, payload);
    }

    public Message publish(final Object payload) {
        if (defaultTopic == null) {
            throw new IllegalStateException("publisher has no default topic");
        }
        return broker.publish(defaultTopic, payload);
    }
}
