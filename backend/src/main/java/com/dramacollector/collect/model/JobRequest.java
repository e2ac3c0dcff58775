package com.dramacollector.collect.model;

public record JobRequest(
    JobTrigger trigger,
    int requestedCount,
    boolean exportEnabled,
    double qualityThreshold,
    int attempt
) {
    public JobRequest {
        trigger = trigger == null ? JobTrigger.MANUAL : trigger;
        requestedCount = Math.max(1, requestedCount);
        qualityThreshold = Math.max(0.0, qualityThreshold);
        attempt = Math.max(1, attempt);
    }

    public JobRequest(JobTrigger trigger, int requestedCount, boolean exportEnabled, double qualityThreshold) {
        this(trigger, requestedCount, exportEnabled, qualityThreshold, 1);
    }

    public JobRequest nextAttempt() {
        return new JobRequest(trigger, requestedCount, exportEnabled, qualityThreshold, attempt + 1);
    }
}
