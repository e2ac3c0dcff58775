package com.dramacollector.collect.model;

public enum JobState {
    IDLE,
    COLLECTING,
    PROCESSING,
    STORING,
    EXPORTING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
