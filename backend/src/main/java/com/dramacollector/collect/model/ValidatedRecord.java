package com.dramacollector.collect.model;

public record ValidatedRecord(CanonicalRecord record, ValidationResult validation) {
    public String dedupKey() {
        return record.dedupKey();
    }

    public double qualityScore() {
        return validation.qualityScore();
    }
}
