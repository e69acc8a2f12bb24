package io.relaybroker.broker;

import io.relaybroker.core.model.MessageStatus;
import io.relaybroker.subscriber.Subscriber;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of published data together with its delivery lifecycle.
 * <p>
 * Messages are allocated by the broker and mutated only by its delivery loop: every mutator is
 * package-private, so handlers, retry policies and publishers only see the read accessors.
 * </p>
 *
 * <p>
 * {@link #getAttempts()} counts delivery passes. A pass offers the message once to every target
 * that has not yet accepted it, so each pending target has been attempted exactly
 * {@code attempts} times.
 * </p>
 */
@Getter
@ToString
public final class Message {
    private final long id;
    private final String topic;
    private final Object payload;
    private final Instant createdAt;

    private MessageStatus status = MessageStatus.CREATED;
    private int attempts;
    private Instant lastTouchedAt;

    @ToString.Exclude
    private List<SubscriberDelivery> deliveries;

    public Message(final long id, final String topic, final Object payload, final Instant createdAt) {
        this.id = id;
        this.topic = Objects.requireNonNull(topic, "topic");
        this.payload = payload;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastTouchedAt = createdAt;
    }

    void touch(final Instant now) {
        this.lastTouchedAt = now;
    }

    void transitionTo(final MessageStatus next) {
        this.status = Objects.requireNonNull(next, "next");
    }

    /**
     * Fixes the subscribers this message must reach. Only the first call has an effect, so
     * subscribers registered after the first delivery pass are not targeted by retries.
     */
    void assignTargets(final List<Subscriber> subscribers) {
        if (deliveries != null) return;

        final List<SubscriberDelivery> list = new ArrayList<>(subscribers.size());
        for (final Subscriber s : subscribers) {
            list.add(new SubscriberDelivery(s));
        }
        this.deliveries = list;
    }

    public boolean hasTargets() {
        return deliveries != null && !deliveries.isEmpty();
    }

    /**
     * Starts a delivery pass and returns the new attempt count.
     */
    int beginPass() {
        return ++attempts;
    }

    List<SubscriberDelivery> pendingDeliveries() {
        if (deliveries == null) return List.of();

        final List<SubscriberDelivery> pending = new ArrayList<>();
        for (final SubscriberDelivery d : deliveries) {
            if (d.isPending()) pending.add(d);
        }
        return pending;
    }

    public List<SubscriberDelivery> getDeliveries() {
        return deliveries == null ? List.of() : Collections.unmodifiableList(deliveries);
    }

    /**
     * Delivery status towards the first target with the given subscriber name.
     */
    public Optional<MessageStatus> deliveryStatus(final String subscriberName) {
        for (final SubscriberDelivery d : getDeliveries()) {
            if (d.getSubscriberName().equals(subscriberName)) {
                return Optional.of(d.getStatus());
            }
        }
        return Optional.empty();
    }

    int beginAttempt(final SubscriberDelivery delivery) {
        status = MessageStatus.DELIVERING;
        return delivery.beginAttempt();
    }

    void recordSuccess(final SubscriberDelivery delivery) {
        delivery.succeeded();
    }

    void recordFailure(final SubscriberDelivery delivery, final String error) {
        delivery.failed(error);
    }

    void requeuePending() {
        for (final SubscriberDelivery d : pendingDeliveries()) {
            d.requeued();
        }
        status = MessageStatus.QUEUED;
    }

    void deadLetterPending() {
        for (final SubscriberDelivery d : pendingDeliveries()) {
            d.deadLettered();
        }
        status = MessageStatus.DEAD_LETTER;
    }
}
