package com.dramacollector.collect.source;

import com.dramacollector.collect.model.RawRecord;

import java.util.List;

/**
 * Raised when a source has fewer records than requested and nothing left to page through.
 * The records it did return travel with the exception.
 */
public class SourceExhaustedException extends SourceException {
    private final transient List<RawRecord> partialRecords;
    private final int requested;

    public SourceExhaustedException(String source, int requested, List<RawRecord> partialRecords) {
        super(source, "source exhausted after " + partialRecords.size() + " of " + requested + " records");
        this.requested = requested;
        this.partialRecords = List.copyOf(partialRecords);
    }

    public List<RawRecord> getPartialRecords() {
        return partialRecords;
    }

    public int getRequested() {
        return requested;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
