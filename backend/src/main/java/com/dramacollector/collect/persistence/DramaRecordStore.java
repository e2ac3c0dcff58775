package com.dramacollector.collect.persistence;

import com.dramacollector.collect.model.StoredDrama;
import com.dramacollector.collect.model.ValidatedRecord;

import java.util.List;
import java.util.Optional;

public interface DramaRecordStore {
    /**
     * Inserts or replaces each record by dedup key.
     *
     * @return number of rows written
     * @throws StoreUnavailableException when the database cannot be reached or rejects a write
     */
    int upsert(String jobId, List<ValidatedRecord> records);

    List<StoredDrama> findDramas(int limit, String genre);

    Optional<StoredDrama> findByKey(String dedupKey);

    long count();

    boolean isReachable();
}
