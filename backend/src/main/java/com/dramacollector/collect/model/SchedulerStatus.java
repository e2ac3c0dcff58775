package com.dramacollector.collect.model;

import java.time.Instant;

public record SchedulerStatus(
    boolean running,
    Instant nextScheduledAt,
    Instant lastTriggeredAt,
    String lastJobId,
    String lastOutcome,
    Instant lastMaintenanceAt
) {}
