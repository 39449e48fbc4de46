package com.syncpipeline.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.syncpipeline.model.RawRecord;
import com.syncpipeline.model.SyncFlags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Local record store keyed by record id.
 *
 * Writes are upserts, so overlapping or repeated chunks are harmless.
 * Bounded by the Caffeine cache size configured in {@code CacheConfig}.
 */
@Repository
@Slf4j
public class InMemoryRecordStore implements RecordStore {

    private final Cache<String, RawRecord> recordCache;

    public InMemoryRecordStore(Cache<String, RawRecord> recordCache) {
        this.recordCache = recordCache;
    }

    @Override
    public void persist(List<RawRecord> chunk, SyncFlags flags) throws StorageException {
        if (chunk.isEmpty()) return;

        log.debug("Persisting {} records (manualSync={}, providerManualSync={})",
                chunk.size(), flags.manualSync(), flags.providerManualSync());
        try {
            for (RawRecord record : chunk) {
                recordCache.put(record.id(), record);
            }
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store chunk of " + chunk.size() + " records", e);
        }
    }

    public Optional<RawRecord> findById(String id) {
        return Optional.ofNullable(recordCache.getIfPresent(id));
    }

    public long count() {
        return recordCache.estimatedSize();
    }
}
