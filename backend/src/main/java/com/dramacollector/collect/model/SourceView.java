package com.dramacollector.collect.model;

public record SourceView(
    String name,
    String type,
    int priority,
    double rateLimit,
    int burst,
    int maxRetries,
    long retryDelayMs,
    long timeoutSeconds,
    boolean enabled
) {
    public static SourceView from(SourceDescriptor descriptor) {
        return new SourceView(
            descriptor.name(),
            descriptor.type(),
            descriptor.priority(),
            descriptor.rateLimit(),
            descriptor.burst(),
            descriptor.maxRetries(),
            descriptor.retryDelay().toMillis(),
            descriptor.timeout().toSeconds(),
            descriptor.enabled()
        );
    }
}
