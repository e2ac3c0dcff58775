package com.dramacollector.collect.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
