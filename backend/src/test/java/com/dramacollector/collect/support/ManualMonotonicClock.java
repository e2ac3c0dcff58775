package com.dramacollector.collect.support;

import com.dramacollector.collect.util.MonotonicClock;
import com.dramacollector.collect.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Monotonic clock that only moves when slept on, so waits are observable and instant.
 */
public final class ManualMonotonicClock implements MonotonicClock, Sleeper {
    private long nanos;
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public synchronized long nanoTime() {
        return nanos;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        nanos += duration.toNanos();
    }

    public synchronized void advance(Duration duration) {
        nanos += duration.toNanos();
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
