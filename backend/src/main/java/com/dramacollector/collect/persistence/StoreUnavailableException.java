package com.dramacollector.collect.persistence;

public class StoreUnavailableException extends RuntimeException {
    private final int written;

    public StoreUnavailableException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public StoreUnavailableException(String message, Throwable cause, int written) {
        super(message, cause);
        this.written = written;
    }

    /**
     * Rows committed before the failure.
     */
    public int getWritten() {
        return written;
    }
}
