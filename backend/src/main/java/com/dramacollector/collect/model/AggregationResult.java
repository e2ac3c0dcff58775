package com.dramacollector.collect.model;

import java.util.List;
import java.util.Map;

public record AggregationResult(
    List<CanonicalRecord> records,
    List<SourceError> errors,
    Map<String, Integer> rawCountsBySource
) {
    public AggregationResult {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
        rawCountsBySource = Map.copyOf(rawCountsBySource);
    }
}
