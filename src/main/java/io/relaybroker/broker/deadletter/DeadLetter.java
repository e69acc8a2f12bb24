package io.relaybroker.broker.deadletter;

import io.relaybroker.broker.Message;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A message that exhausted its retries. {@code errors} maps each subscriber that never
 * accepted it to the last error that subscriber reported, in target order.
 */
public record DeadLetter(Message message, Map<String, String> errors, Instant deadLetteredAt) {

    public DeadLetter {
        Objects.requireNonNull(message, "message");
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        Objects.requireNonNull(deadLetteredAt, "deadLetteredAt");
    }

    public List<String> failedSubscribers() {
        return List.copyOf(errors.keySet());
    }

    /** Last error reported by {@code subscriberName}, or null when it was not a failed target. */
    public String error(final String subscriberName) {
        return errors.get(subscriberName);
    }

    public String topic() {
        return message.getTopic();
    }

    public long messageId() {
        return message.getId();
    }
}
