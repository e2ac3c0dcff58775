package com.dramacollector.collect.source;

import com.dramacollector.collect.model.SourceDescriptor;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;
import com.dramacollector.config.CollectorProperties;

@FunctionalInterface
public interface SourceAdapterFactory {
    DramaSource create(
        SourceDescriptor descriptor,
        CollectorProperties.Source settings,
        TokenBucketRateLimiter rateLimiter
    );
}
