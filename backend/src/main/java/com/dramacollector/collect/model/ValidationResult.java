package com.dramacollector.collect.model;

import java.util.ArrayList;
import java.util.List;

public record ValidationResult(
    double qualityScore,
    List<String> errors,
    List<String> warnings
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> issues() {
        List<String> issues = new ArrayList<>(errors);
        issues.addAll(warnings);
        return issues;
    }
}
