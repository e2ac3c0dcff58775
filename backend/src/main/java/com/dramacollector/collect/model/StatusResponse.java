package com.dramacollector.collect.model;

public record StatusResponse(
    boolean storeReachable,
    long storedDramas,
    int availableJobSlots,
    JobSnapshot currentJob,
    SchedulerStatus scheduler
) {}
