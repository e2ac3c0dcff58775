package com.dramacollector.collect.model;

import com.dramacollector.config.CollectorProperties;

import java.time.Duration;
import java.util.Locale;

public record SourceDescriptor(
    String name,
    String type,
    int priority,
    double rateLimit,
    int burst,
    int maxRetries,
    Duration retryDelay,
    Duration timeout,
    boolean enabled
) {
    public static SourceDescriptor from(String name, CollectorProperties.Source source) {
        String type = source.getType() == null ? "api" : source.getType().trim().toLowerCase(Locale.ROOT);
        return new SourceDescriptor(
            name,
            type,
            source.getPriority(),
            source.getRateLimit(),
            source.getBurst(),
            source.getMaxRetries(),
            Duration.ofMillis(source.getRetryDelayMs()),
            Duration.ofSeconds(source.getTimeoutSeconds()),
            source.isEnabled()
        );
    }
}
