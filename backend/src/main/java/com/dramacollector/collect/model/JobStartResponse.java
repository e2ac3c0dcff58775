package com.dramacollector.collect.model;

public record JobStartResponse(String jobId, String message) {}
