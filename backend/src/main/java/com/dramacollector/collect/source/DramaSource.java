package com.dramacollector.collect.source;

import com.dramacollector.collect.model.RawRecord;

import java.util.List;

/**
 * One external source of drama metadata. Implementations acquire their own rate limiter
 * before every network operation and keep no other shared state.
 */
public interface DramaSource {
    String name();

    /**
     * Returns up to {@code count} records.
     *
     * @throws SourceExhaustedException when fewer than {@code count} records exist; the
     *     exception carries the records that were found
     */
    List<RawRecord> fetchList(int count) throws SourceException, InterruptedException;

    RawRecord fetchDetail(String sourceId) throws SourceException, InterruptedException;
}
