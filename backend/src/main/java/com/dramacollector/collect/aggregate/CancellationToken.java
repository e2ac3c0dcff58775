package com.dramacollector.collect.aggregate;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared between a job and the aggregation it started. Checked
 * between stages and between retries; in-flight calls are left to finish.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
