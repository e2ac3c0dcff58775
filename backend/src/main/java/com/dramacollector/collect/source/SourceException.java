package com.dramacollector.collect.source;

public abstract class SourceException extends Exception {
    private final String source;

    protected SourceException(String source, String message) {
        super(message);
        this.source = source;
    }

    protected SourceException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    public abstract boolean isRetryable();
}
