package com.dramacollector.collect.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of drama attributes. Absent and blank values are never stored, so
 * {@link #has(DramaField)} is the single test for "populated".
 */
public final class DramaAttributes {
    private static final DramaAttributes EMPTY = new DramaAttributes(new EnumMap<>(DramaField.class));

    private final EnumMap<DramaField, Object> values;

    private DramaAttributes(EnumMap<DramaField, Object> values) {
        this.values = values;
    }

    public static DramaAttributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    public Object get(DramaField field) {
        return values.get(field);
    }

    public boolean has(DramaField field) {
        return values.containsKey(field);
    }

    public Set<DramaField> populatedFields() {
        return values.isEmpty() ? EnumSet.noneOf(DramaField.class) : EnumSet.copyOf(values.keySet());
    }

    public int populatedCount() {
        return values.size();
    }

    /**
     * Returns a copy where every populated field of {@code other} replaces the value here.
     */
    public DramaAttributes overlay(DramaAttributes other) {
        if (other == null || other.values.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        other.values.forEach(builder::set);
        return builder.build();
    }

    public String title() {
        return (String) values.get(DramaField.TITLE);
    }

    public Integer year() {
        return (Integer) values.get(DramaField.YEAR);
    }

    public Double rating() {
        return (Double) values.get(DramaField.RATING);
    }

    public List<String> genres() {
        return list(DramaField.GENRES);
    }

    public String synopsis() {
        return (String) values.get(DramaField.SYNOPSIS);
    }

    public Integer episodes() {
        return (Integer) values.get(DramaField.EPISODES);
    }

    public List<String> directors() {
        return list(DramaField.DIRECTORS);
    }

    public List<String> casts() {
        return list(DramaField.CASTS);
    }

    public List<String> tags() {
        return list(DramaField.TAGS);
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((field, value) -> out.put(field.key(), value));
        return out;
    }

    private List<String> list(DramaField field) {
        if (!(values.get(field) instanceof List<?> items)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(items.size());
        for (Object item : items) {
            out.add((String) item);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DramaAttributes that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "DramaAttributes" + toMap();
    }

    public static final class Builder {
        private final EnumMap<DramaField, Object> values = new EnumMap<>(DramaField.class);

        private Builder() {
        }

        public Builder title(String title) {
            return set(DramaField.TITLE, title == null ? null : title.strip());
        }

        public Builder year(Integer year) {
            return set(DramaField.YEAR, year);
        }

        public Builder rating(Double rating) {
            return set(DramaField.RATING, rating);
        }

        public Builder genres(Collection<String> genres) {
            return set(DramaField.GENRES, genres);
        }

        public Builder synopsis(String synopsis) {
            return set(DramaField.SYNOPSIS, synopsis == null ? null : synopsis.strip());
        }

        public Builder episodes(Integer episodes) {
            return set(DramaField.EPISODES, episodes);
        }

        public Builder directors(Collection<String> directors) {
            return set(DramaField.DIRECTORS, directors);
        }

        public Builder casts(Collection<String> casts) {
            return set(DramaField.CASTS, casts);
        }

        public Builder tags(Collection<String> tags) {
            return set(DramaField.TAGS, tags);
        }

        public Builder set(DramaField field, Object value) {
            Object normalized = normalize(field, value);
            if (field.isPopulated(normalized)) {
                values.put(field, normalized);
            } else {
                values.remove(field);
            }
            return this;
        }

        public DramaAttributes build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new DramaAttributes(new EnumMap<>(values));
        }

        private static Object normalize(DramaField field, Object value) {
            if (value == null) {
                return null;
            }
            if (field.isListValued()) {
                if (!(value instanceof Collection<?> items)) {
                    throw new IllegalArgumentException(field.key() + " expects a list value");
                }
                List<String> cleaned = new ArrayList<>();
                for (Object item : items) {
                    if (item == null) {
                        continue;
                    }
                    String text = item.toString().strip();
                    if (!text.isEmpty()) {
                        cleaned.add(text);
                    }
                }
                return Collections.unmodifiableList(cleaned);
            }
            return switch (field) {
                case TITLE, SYNOPSIS -> value.toString();
                case YEAR, EPISODES -> value instanceof Number number ? Integer.valueOf(number.intValue()) : null;
                case RATING -> value instanceof Number number ? Double.valueOf(number.doubleValue()) : null;
                default -> value;
            };
        }
    }
}
