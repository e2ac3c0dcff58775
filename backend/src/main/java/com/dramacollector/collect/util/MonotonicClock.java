package com.dramacollector.collect.util;

/**
 * Source of monotonic time for rate limiting. Tests swap in a manual clock.
 */
@FunctionalInterface
public interface MonotonicClock {
    MonotonicClock SYSTEM = System::nanoTime;

    long nanoTime();
}
