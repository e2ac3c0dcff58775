package com.dramacollector.collect.aggregate;

import java.time.Duration;

/**
 * Attempt counter for one source call. Not thread-safe; each fan-out task owns its own.
 */
public class RetryState {
    private final BackoffPolicy policy;
    private int attempts;
    private int retries;

    public RetryState(BackoffPolicy policy) {
        this.policy = policy;
    }

    public void beginAttempt() {
        attempts++;
    }

    public boolean canRetry() {
        return retries < policy.maxRetries();
    }

    /**
     * Consumes one retry and returns how long to wait before it.
     */
    public Duration nextDelay() {
        if (!canRetry()) {
            throw new IllegalStateException("retries exhausted after " + attempts + " attempts");
        }
        retries++;
        return policy.delayFor(retries);
    }

    public int attempts() {
        return attempts;
    }

    public int retries() {
        return retries;
    }
}
