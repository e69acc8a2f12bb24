package io.relaybroker.broker;

import io.relaybroker.core.model.MessageStatus;
import io.relaybroker.subscriber.Subscriber;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Delivery progress of one message towards one subscriber.
 */
@Getter
@ToString
public final class SubscriberDelivery {
    @ToString.Exclude
    private final Subscriber subscriber;
    private MessageStatus status = MessageStatus.QUEUED;
    private int attempts;
    private String lastError;

    SubscriberDelivery(final Subscriber subscriber) {
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
    }

    public String getSubscriberName() {
        return subscriber.name();
    }

    public boolean isPending() {
        return status != MessageStatus.DELIVERED && status != MessageStatus.DEAD_LETTER;
    }

    int beginAttempt() {
        status = MessageStatus.DELIVERING;
        return ++attempts;
    }

    void succeeded() {
        status = MessageStatus.DELIVERED;
        lastError = null;
    }

    void failed(final String error) {
        status = MessageStatus.FAILED;
        lastError = error;
    }

    void requeued() {
        status = MessageStatus.QUEUED;
    }

    void deadLettered() {
        status = MessageStatus.DEAD_LETTER;
    }
}
