package com.dramacollector.collect.model;

public enum SourceErrorKind {
    UNAVAILABLE,
    REJECTED,
    DETAIL_FAILED,
    CANCELLED
}
