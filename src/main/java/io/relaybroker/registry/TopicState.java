package io.relaybroker.registry;

import io.relaybroker.broker.metrics.TopicMetrics;
import io.relaybroker.broker.metrics.TopicSummary;
import io.relaybroker.broker.Message;
import io.relaybroker.subscriber.Subscriber;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Everything a topic owns: its pending queue (FIFO), its subscribers and its counters.
 */
public final class TopicState {
    @Getter
    private final String name;
    private final Deque<Message> queue = new ArrayDeque<>();
    private final List<Subscriber> subscribers = new ArrayList<>();
    @Getter
    private final TopicMetrics metrics = new TopicMetrics();

    TopicState(final String name) {
        this.name = name;
    }

    public void addSubscriber(final Subscriber subscriber) {
        subscribers.add(subscriber);
    }

    public List<Subscriber> subscribers() {
        return Collections.unmodifiableList(new ArrayList<>(subscribers));
    }

    public int queueLength() {
        return queue.size();
    }

    public void append(final Message message) {
        queue.addLast(message);
    }

    /**
     * @return the head of the queue, or {@code null} when empty
     */
    public Message poll() {
        return queue.pollFirst();
    }

    public List<Message> pending() {
        return List.copyOf(queue);
    }

    public TopicSummary summary() {
        return metrics.snapshot(name, queue.size(), subscribers.size());
    }
}
