package com.dramacollector.collect.validation;

import java.util.Locale;

public enum ValidationLevel {
    STRICT,
    MODERATE,
    LENIENT;

    public static ValidationLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MODERATE;
        }
    }
}
