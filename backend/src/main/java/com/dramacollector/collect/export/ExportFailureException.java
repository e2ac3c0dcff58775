package com.dramacollector.collect.export;

public class ExportFailureException extends RuntimeException {
    public ExportFailureException(String message) {
        super(message);
    }

    public ExportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
