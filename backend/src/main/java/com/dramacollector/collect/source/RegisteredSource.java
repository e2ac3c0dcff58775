package com.dramacollector.collect.source;

import com.dramacollector.collect.model.SourceDescriptor;

public record RegisteredSource(SourceDescriptor descriptor, DramaSource source) {
    public String name() {
        return descriptor.name();
    }

    public int priority() {
        return descriptor.priority();
    }
}
