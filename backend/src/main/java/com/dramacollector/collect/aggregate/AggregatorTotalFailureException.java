package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.SourceError;

import java.util.List;

public class AggregatorTotalFailureException extends RuntimeException {
    private final transient List<SourceError> errors;

    public AggregatorTotalFailureException(String message, List<SourceError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<SourceError> getErrors() {
        return errors;
    }
}
