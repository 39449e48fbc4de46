package com.syncpipeline.repository;

import com.syncpipeline.model.RawRecord;
import com.syncpipeline.model.SyncFlags;

import java.util.List;

/**
 * Storage collaborator the pipeline writes chunks through.
 *
 * Implementations must tolerate records that were already persisted by an earlier
 * chunk or batch. A failure applies to the whole chunk.
 */
public interface RecordStore {

    void persist(List<RawRecord> chunk, SyncFlags flags) throws StorageException;
}
