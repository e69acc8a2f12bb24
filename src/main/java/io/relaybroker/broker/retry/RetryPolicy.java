package io.relaybroker.broker.retry;

import io.relaybroker.broker.Message;

import java.time.Duration;

/**
 * Decides whether a failed message gets another delivery pass, and after how long.
 * Both decisions are driven only by {@link Message#getAttempts()}.
 */
public interface RetryPolicy {

    /**
     * @param message the message whose latest pass failed
     * @return {@code true} to requeue, {@code false} to dead-letter
     */
    boolean shouldRetry(Message message);

    /**
     * Back-off before the next pass. The broker reports this value but does not wait on it.
     */
    Duration computeDelay(Message message);
}
