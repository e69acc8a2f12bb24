package io.relaybroker.broker;

import io.relaybroker.broker.deadletter.DeadLetter;
import io.relaybroker.broker.deadletter.DeadLetterStore;
import io.relaybroker.broker.delivery.DeliveryContext;
import io.relaybroker.broker.delivery.DeliveryStrategy;
import io.relaybroker.broker.delivery.ImmediateDeliveryStrategy;
import io.relaybroker.broker.event.BrokerEvent;
import io.relaybroker.broker.event.BrokerEventType;
import io.relaybroker.broker.event.BrokerListener;
import io.relaybroker.broker.metrics.TopicSummary;
import io.relaybroker.broker.retry.RetryPolicy;
import io.relaybroker.broker.retry.SimpleRetryPolicy;
import io.relaybroker.core.model.MessageStatus;
import io.relaybroker.core.sequence.MessageIdSequence;
import io.relaybroker.registry.TopicRegistry;
import io.relaybroker.registry.TopicState;
import io.relaybroker.subscriber.DeliveryOutcome;
import io.relaybroker.subscriber.Subscriber;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Broker owns every topic queue, subscriber list and metrics record of one process-local
 * pub/sub domain.
 * <p>
 * Publishing hands the message to the active {@link DeliveryStrategy}; draining a topic pops
 * its queue in FIFO order and offers each message to the subscribers that have not yet accepted
 * it. Failed passes go through the {@link RetryPolicy}: the message is either appended to the
 * tail of its queue or moved to the {@link DeadLetterStore}.
 * </p>
 *
 * <p>
 * All work runs synchronously on the calling thread while holding the broker's monitor, and every
 * state change is reported to the registered {@link BrokerListener}s, in registration order,
 * before the triggering call returns. Handlers may publish back into the same broker.
 * </p>
 */
@Slf4j
public final class Broker {
    public static final int DEFAULT_MAX_QUEUE_SIZE = 10;

    private final TopicRegistry registry;
    private final DeadLetterStore deadLetters;
    private final RetryPolicy retryPolicy;
    private final int maxQueueSize;
    private final Clock clock;
    private final MessageIdSequence ids = new MessageIdSequence();
    private final List<BrokerListener> listeners = new CopyOnWriteArrayList<>();
    private final DeliveryContext context = new Context();

    private volatile DeliveryStrategy deliveryStrategy;

    private Broker(final Builder b) {
        if (b.maxQueueSize <= 0) throw new IllegalArgumentException("maxQueueSize must be > 0");

        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.deadLetters = Objects.requireNonNull(b.deadLetters, "deadLetters");
        this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy");
        this.deliveryStrategy = Objects.requireNonNull(b.deliveryStrategy, "deliveryStrategy");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.maxQueueSize = b.maxQueueSize;
        this.listeners.addAll(b.listeners);
    }

    public Broker() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    /* ---------- listeners ---------- */

    public void registerListener(final BrokerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /* ---------- topic operations ---------- */

    public synchronized void addSubscriber(final String topic, final Subscriber subscriber) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(subscriber, "subscriber");

        registry.getOrCreate(topic).addSubscriber(subscriber);
        log.debug("Subscriber {} added to topic {}", subscriber.name(), topic);
        emit(BrokerEvent.of(BrokerEventType.SUBSCRIBER_ADDED, "topic", topic, "subscriber", subscriber.name()));
    }

    /**
     * Publishes a payload. With the immediate strategy the message has already been delivered,
     * requeued or dead-lettered by the time this returns.
     *
     * @return the message handle, for status inspection
     */
    public synchronized Message publish(final String topic, final Object payload) {
        Objects.requireNonNull(topic, "topic");

        final TopicState state = registry.getOrCreate(topic);
        final Message message = new Message(ids.next(), topic, payload, clock.instant());
        state.getMetrics().recordPublished();

        deliveryStrategy.publish(context, topic, message);
        return message;
    }

    /**
     * Delivers everything queued on the topic, including retries scheduled during this call.
     */
    public synchronized void drain(final String topic) {
        final TopicState state = registry.find(topic).orElse(null);
        if (state == null || state.queueLength() == 0) return;

        final List<Subscriber> subscribers = state.subscribers();
        Message message;
        while ((message = state.poll()) != null) {
            deliver(state, message, subscribers);
        }
    }

    public synchronized void flush(final String topic) {
        Objects.requireNonNull(topic, "topic");
        deliveryStrategy.flush(context, topic);
    }

    public synchronized void swapStrategy(final DeliveryStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");

        final String old = deliveryStrategy.name();
        deliveryStrategy = strategy;
        log.info("Delivery strategy swapped: {} -> {}", old, strategy.name());
        emit(BrokerEvent.of(BrokerEventType.STRATEGY_SWAPPED, "old", old, "new", strategy.name()));
    }

    /**
     * Per-topic counters plus live queue length and subscriber count, in topic creation order.
     */
    public synchronized Map<String, TopicSummary> summarize() {
        final Map<String, TopicSummary> out = new LinkedHashMap<>();
        for (final TopicState state : registry.states()) {
            out.put(state.getName(), state.summary());
        }
        return Collections.unmodifiableMap(out);
    }

    /* ---------- accessors ---------- */

    public DeadLetterStore deadLetters() {
        return deadLetters;
    }

    public DeliveryStrategy deliveryStrategy() {
        return deliveryStrategy;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public int maxQueueSize() {
        return maxQueueSize;
    }

    public synchronized int queueLength(final String topic) {
        return registry.find(topic).map(TopicState::queueLength).orElse(0);
    }

    public synchronized List<Subscriber> subscribers(final String topic) {
        return registry.find(topic).map(TopicState::subscribers).orElse(List.of());
    }

    public synchronized List<Message> pending(final String topic) {
        return registry.find(topic).map(TopicState::pending).orElse(List.of());
    }

    /* ---------- internals ---------- */

    private boolean enqueue(final String topic, final Message message) {
        final TopicState state = registry.getOrCreate(topic);
        final int length = state.queueLength();

        if (length >= maxQueueSize) {
            state.getMetrics().recordDropped();
            log.warn("Backpressure on topic {}: queue full ({}), dropping message {}", topic, length, message.getId());
            emit(BrokerEvent.of(BrokerEventType.BACKPRESSURE, "topic", topic, "queue_length", length));
            return false;
        }

        message.transitionTo(MessageStatus.QUEUED);
        message.touch(clock.instant());
        state.append(message);
        emit(BrokerEvent.of(BrokerEventType.MESSAGE_ENQUEUED,
                "topic", topic, "id", message.getId(), "queue_length", state.queueLength()));
        return true;
    }

    private void deliver(final TopicState state, final Message message, final List<Subscriber> subscribers) {
        final String topic = state.getName();
        message.assignTargets(subscribers);

        if (!message.hasTargets()) {
            message.transitionTo(MessageStatus.DELIVERED);
            state.getMetrics().recordDelivered();
            emit(BrokerEvent.of(BrokerEventType.DELIVERED, "topic", topic, "id", message.getId(), "subs", 0));
            return;
        }

        message.beginPass();
        boolean allDelivered = true;
        for (final SubscriberDelivery delivery : message.pendingDeliveries()) {
            allDelivered &= deliverSingle(state, message, delivery);
        }

        if (allDelivered) {
            message.transitionTo(MessageStatus.DELIVERED);
            state.getMetrics().recordDelivered();
        } else {
            message.transitionTo(MessageStatus.FAILED);
            handleFailure(state, message);
        }
    }

    private boolean deliverSingle(final TopicState state, final Message message, final SubscriberDelivery delivery) {
        final String topic = state.getName();
        final String name = delivery.getSubscriberName();

        final int attempt = message.beginAttempt(delivery);
        message.touch(clock.instant());
        emit(BrokerEvent.of(BrokerEventType.DELIVERING,
                "topic", topic, "id", message.getId(), "attempt", attempt, "subscriber", name));

        final DeliveryOutcome outcome = invoke(delivery.getSubscriber(), message);

        if (outcome instanceof DeliveryOutcome.Failure failure) {
            message.recordFailure(delivery, failure.reason());
            state.getMetrics().recordFailed();
            log.debug("Delivery of message {} on {} to {} failed (attempt {}): {}",
                    message.getId(), topic, name, attempt, failure.reason());
            emit(BrokerEvent.of(BrokerEventType.FAILED,
                    "topic", topic, "id", message.getId(), "subscriber", name, "error", failure.reason()));
            return false;
        }

        message.recordSuccess(delivery);
        emit(BrokerEvent.of(BrokerEventType.DELIVERED, "topic", topic, "id", message.getId(), "subscriber", name));
        return true;
    }

    private DeliveryOutcome invoke(final Subscriber subscriber, final Message message) {
        try {
            final DeliveryOutcome outcome = subscriber.handle(message);
            return outcome != null ? outcome : DeliveryOutcome.failure("handler returned no outcome");
        } catch (final RuntimeException e) {
            return DeliveryOutcome.failure(e);
        }
    }

    private void handleFailure(final TopicState state, final Message message) {
        final String topic = state.getName();

        if (retryPolicy.shouldRetry(message)) {
            message.transitionTo(MessageStatus.RETRY_SCHEDULED);
            final Duration delay = retryPolicy.computeDelay(message);
            emit(BrokerEvent.of(BrokerEventType.RETRY_SCHEDULED,
                    "topic", topic, "id", message.getId(), "delay", delay.toNanos() / 1_000_000_000d));

            // The delay is reported only; the message goes straight back to the tail of the queue.
            message.requeuePending();
            state.append(message);
            return;
        }

        final Map<String, String> errors = new LinkedHashMap<>();
        for (final SubscriberDelivery d : message.pendingDeliveries()) {
            errors.put(d.getSubscriberName(), d.getLastError());
        }

        message.deadLetterPending();
        deadLetters.add(new DeadLetter(message, errors, clock.instant()));
        state.getMetrics().recordDeadLetter();
        log.warn("Message {} on topic {} dead-lettered after {} attempt(s); failed subscribers {}",
                message.getId(), topic, message.getAttempts(), errors.keySet());
        emit(BrokerEvent.of(BrokerEventType.DEAD_LETTER, "topic", topic, "id", message.getId()));
    }

    private void emit(final BrokerEvent event) {
        for (final BrokerListener listener : listeners) {
            listener.onEvent(event);
        }
    }

    private final class Context implements DeliveryContext {
        @Override
        public boolean enqueue(final String topic, final Message message) {
            return Broker.this.enqueue(topic, message);
        }

        @Override
        public int queueLength(final String topic) {
            return Broker.this.queueLength(topic);
        }

        @Override
        public void drain(final String topic) {
            Broker.this.drain(topic);
        }

        @Override
        public void emit(final BrokerEvent event) {
            Broker.this.emit(event);
        }
    }

    public static final class Builder {
        private TopicRegistry registry = new TopicRegistry();
        private DeadLetterStore deadLetters = new DeadLetterStore();
        private RetryPolicy retryPolicy = new SimpleRetryPolicy();
        private DeliveryStrategy deliveryStrategy = new ImmediateDeliveryStrategy();
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
        private Clock clock = Clock.systemUTC();
        private final List<BrokerListener> listeners = new ArrayList<>();

        public Builder registry(final TopicRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder deadLetters(final DeadLetterStore deadLetters) {
            this.deadLetters = deadLetters;
            return this;
        }

        public Builder retryPolicy(final RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder deliveryStrategy(final DeliveryStrategy deliveryStrategy) {
            this.deliveryStrategy = deliveryStrategy;
            return this;
        }

        public Builder maxQueueSize(final int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder listener(final BrokerListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Broker build() {
            return new Broker(this);
        }
    }
}
