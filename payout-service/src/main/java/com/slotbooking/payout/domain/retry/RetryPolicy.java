package com.slotbooking.payout.domain.retry;

import java.time.Duration;

/**
 * Backoff schedule for retryable payout failures.
 */
public interface RetryPolicy {

    /**
     * Delay before retry number {@code attempt}, counting from 1.
     */
    Duration delayFor(int attempt);

    /** Retries allowed after the first attempt; the next failure after that is terminal. */
    int maxRetries();

    default boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries();
    }
}
