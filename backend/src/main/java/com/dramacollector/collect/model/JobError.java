package com.dramacollector.collect.model;

import java.time.Instant;

public record JobError(String source, String message, Instant timestamp) {}
