package com.dramacollector.collect.model;

public enum JobTrigger {
    MANUAL,
    SCHEDULED
}
