package io.relaybroker.core.model;

/**
 * Lifecycle states of a {@link io.relaybroker.broker.Message}.
 * <p>
 * CREATED → QUEUED → DELIVERING → {DELIVERED | FAILED → RETRY_SCHEDULED → QUEUED … | FAILED → DEAD_LETTER}
 */
public enum MessageStatus {
    /**
     * Allocated by the broker, not yet accepted into a topic queue.
     */
    CREATED,
    /**
     * Sitting in a topic queue, either on first enqueue or after a retry was scheduled.
     */
    QUEUED,
    /**
     * A subscriber handler is being invoked.
     */
    DELIVERING,
    /**
     * Every target subscriber accepted the message.
     */
    DELIVERED,
    /**
     * At least one target subscriber rejected the latest attempt.
     */
    FAILED,
    /**
     * Retry policy accepted another attempt; the message is about to be requeued.
     */
    RETRY_SCHEDULED,
    /**
     * Retries exhausted; the message now lives in the dead-letter store.
     */
    DEAD_LETTER;

    public boolean isTerminal() {
        return this == DELIVERED || this == DEAD_LETTER;
    }
}
