package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.SourceDescriptor;

import java.time.Duration;

public record BackoffPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {
    public BackoffPolicy {
        maxRetries = Math.max(0, maxRetries);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
    }

    public static BackoffPolicy of(SourceDescriptor descriptor, Duration maxDelay) {
        return new BackoffPolicy(descriptor.maxRetries(), descriptor.retryDelay(), maxDelay);
    }

    /**
     * {@code baseDelay * 2^(retry-1)}, capped at {@code maxDelay}. {@code retry} starts at 1.
     */
    public Duration delayFor(int retry) {
        int exponent = Math.max(0, retry - 1);
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        if (base == 0) {
            return Duration.ZERO;
        }
        if (exponent >= 62 || base > (cap >> Math.min(exponent, 62))) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(cap, base << exponent));
    }
}
