package com.dramacollector.collect.model;

import java.time.Instant;

public record SourceError(
    String source,
    SourceErrorKind kind,
    String message,
    Instant timestamp,
    int attempts
) {}
