package io.relaybroker.broker.retry;

import io.relaybroker.broker.Message;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Bounded attempts with linear back-off: {@code max(attempts, 1) * backoffFactor} seconds.
 */
@Getter
@ToString
public final class SimpleRetryPolicy implements RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_BACKOFF_FACTOR = 0.25d;

    private final int maxAttempts;
    private final double backoffFactor;

    public SimpleRetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_FACTOR);
    }

    /**
     * @param maxAttempts   total delivery passes allowed, including the first one
     * @param backoffFactor seconds of delay per attempt already made
     */
    public SimpleRetryPolicy(final int maxAttempts, final double backoffFactor) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (backoffFactor < 0 || Double.isNaN(backoffFactor) || Double.isInfinite(backoffFactor)) {
            throw new IllegalArgumentException("backoffFactor must be a finite value >= 0");
        }
        this.maxAttempts = maxAttempts;
        this.backoffFactor = backoffFactor;
    }

    @Override
    public boolean shouldRetry(final Message message) {
        return message.getAttempts() < maxAttempts;
    }

    @Override
    public Duration computeDelay(final Message message) {
        final int attempts = Math.max(message.getAttempts(), 1);
        return Duration.ofNanos(Math.round(attempts * backoffFactor * 1_000_000_000d));
    }
}
