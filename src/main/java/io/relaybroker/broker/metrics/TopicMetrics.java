package io.relaybroker.broker.metrics;

import lombok.Getter;
import lombok.ToString;

/**
 * Running counters for one topic. Not thread-safe; the owning broker serializes access.
 * <p>
 * {@code published} counts publish attempts, including ones dropped by backpressure.
 * {@code delivered} and {@code deadLetter} count messages, {@code failed} counts failed
 * subscriber attempts.
 * </p>
 */
@Getter
@ToString
public final class TopicMetrics {
    private long published;
    private long delivered;
    private long failed;
    private long deadLetter;
    private long dropped;

    public void recordPublished() {
        published++;
    }

    public void recordDelivered() {
        delivered++;
    }

    public void recordFailed() {
        failed++;
    }

    public void recordDeadLetter() {
        deadLetter++;
    }

    public void recordDropped() {
        dropped++;
    }

    public TopicSummary snapshot(final String topic, final int queueLength, final int subscriberCount) {
        return new TopicSummary(topic, published, delivered, failed, deadLetter, dropped, queueLength, subscriberCount);
    }
}
