package io.relaybroker.broker.metrics;

/**
 * Point-in-time view of a topic's counters, queue and subscribers.
 */
public record TopicSummary(String topic,
                           long published,
                           long delivered,
                           long failed,
                           long deadLetter,
                           long dropped,
                           int queueLength,
                           int subscriberCount) {

    /**
     * Messages published but neither delivered, dead-lettered nor dropped.
     */
    public long outstanding() {
        return published - delivered - deadLetter - dropped;
    }
}
