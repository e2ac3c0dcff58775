package com.dramacollector.collect.source;

public class SourceRejectedException extends SourceException {
    public SourceRejectedException(String source, String message) {
        super(source, message);
    }

    public SourceRejectedException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
