package com.dramacollector.collect.ratelimit;

import com.dramacollector.collect.util.MonotonicClock;
import com.dramacollector.collect.util.Sleeper;

import java.time.Duration;

/**
 * Token bucket shared by every call a source makes. Tokens refill continuously at
 * {@code ratePerSecond} up to {@code burst}; the bucket starts full.
 *
 * <p>A limiter with a zero rate never hands out a token: {@link #acquire()} blocks until the
 * calling thread is interrupted and {@link #tryAcquire()} always returns {@code false}.
 */
public class TokenBucketRateLimiter {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double ratePerSecond;
    private final double capacity;
    private final boolean unlimited;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final Object stalled = new Object();

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double ratePerSecond, int burst) {
        this(ratePerSecond, burst, MonotonicClock.SYSTEM, Sleeper.SYSTEM);
    }

    public TokenBucketRateLimiter(double ratePerSecond, int burst, MonotonicClock clock, Sleeper sleeper) {
        this(ratePerSecond, burst, false, clock, sleeper);
    }

    private TokenBucketRateLimiter(
        double ratePerSecond,
        int burst,
        boolean unlimited,
        MonotonicClock clock,
        Sleeper sleeper
    ) {
        this.ratePerSecond = Math.max(0.0, ratePerSecond);
        this.capacity = Math.max(1, burst);
        this.unlimited = unlimited;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = this.ratePerSecond > 0 ? this.capacity : 0.0;
        this.lastRefillNanos = clock.nanoTime();
    }

    public static TokenBucketRateLimiter unlimited() {
        return new TokenBucketRateLimiter(Double.POSITIVE_INFINITY, 1, true, MonotonicClock.SYSTEM, Sleeper.SYSTEM);
    }

    public void acquire() throws InterruptedException {
        if (unlimited) {
            return;
        }
        if (ratePerSecond <= 0) {
            awaitForever();
        }
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                waitNanos = (long) Math.ceil((1.0 - tokens) * NANOS_PER_SECOND / ratePerSecond);
            }
            sleeper.sleep(Duration.ofNanos(Math.max(1, waitNanos)));
        }
    }

    public boolean tryAcquire() {
        if (unlimited) {
            return true;
        }
        if (ratePerSecond <= 0) {
            return false;
        }
        synchronized (this) {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        }
    }

    public synchronized double availableTokens() {
        if (unlimited) {
            return Double.POSITIVE_INFINITY;
        }
        refill();
        return tokens;
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    public boolean isUnlimited() {
        return unlimited;
    }

    private void refill() {
        long now = clock.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0 || ratePerSecond <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * ratePerSecond);
        lastRefillNanos = now;
    }

    private void awaitForever() throws InterruptedException {
        synchronized (stalled) {
            while (true) {
                stalled.wait();
            }
        }
    }
}
