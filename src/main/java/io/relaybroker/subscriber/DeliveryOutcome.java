package io.relaybroker.subscriber;

import java.util.Objects;

/**
 * Result of handing a message to a subscriber.
 */
public sealed interface DeliveryOutcome permits DeliveryOutcome.Success, DeliveryOutcome.Failure {

    DeliveryOutcome SUCCESS = new Success();

    static DeliveryOutcome success() {
        return SUCCESS;
    }

    static DeliveryOutcome failure(final String reason) {
        return new Failure(reason);
    }

    /**
     * Builds a failure from an exception, falling back to its class name when it carries no message.
     */
    static DeliveryOutcome failure(final Throwable cause) {
        final String msg = cause.getMessage();
        return new Failure(msg != null ? msg : cause.getClass().getName());
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success() implements DeliveryOutcome {
    }

    record Failure(String reason) implements DeliveryOutcome {
        public Failure {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
