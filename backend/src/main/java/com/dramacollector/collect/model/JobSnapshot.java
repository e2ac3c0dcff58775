package com.dramacollector.collect.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record JobSnapshot(
    String id,
    JobState state,
    JobTrigger trigger,
    int requestedCount,
    boolean exportEnabled,
    double qualityThreshold,
    int attempt,
    Instant startTime,
    Instant endTime,
    int totalCollected,
    int totalProcessed,
    int totalStored,
    int droppedLowQuality,
    boolean cancelled,
    List<JobError> errors,
    List<ExportFileInfo> exports,
    Map<String, Long> stageDurationsMs
) {
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
