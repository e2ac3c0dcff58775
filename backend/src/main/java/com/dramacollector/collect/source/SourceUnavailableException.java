package com.dramacollector.collect.source;

public class SourceUnavailableException extends SourceException {
    public SourceUnavailableException(String source, String message) {
        super(source, message);
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
