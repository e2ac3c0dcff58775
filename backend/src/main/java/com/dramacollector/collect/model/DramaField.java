package com.dramacollector.collect.model;

import java.util.Collection;
import java.util.Locale;

public enum DramaField {
    TITLE,
    YEAR,
    RATING,
    GENRES,
    SYNOPSIS,
    EPISODES,
    DIRECTORS,
    CASTS,
    TAGS;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isListValued() {
        return this == GENRES || this == DIRECTORS || this == CASTS || this == TAGS;
    }

    public boolean isPopulated(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Collection<?> values) {
            return !values.isEmpty();
        }
        if (value instanceof Number number) {
            return number.doubleValue() > 0;
        }
        return true;
    }

    /**
     * Size of a value used to break priority ties: text length, list size, or 1 for numbers.
     */
    public int weight(Object value) {
        if (!isPopulated(value)) {
            return 0;
        }
        if (value instanceof String text) {
            return text.strip().length();
        }
        if (value instanceof Collection<?> values) {
            return values.size();
        }
        return 1;
    }
}
