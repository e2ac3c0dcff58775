package com.dramacollector.collect.api;

public record JobStartRequest(
    Integer count,
    Boolean exportEnabled,
    Double qualityThreshold
) {}
