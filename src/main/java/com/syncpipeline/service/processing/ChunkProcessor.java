package com.syncpipeline.service.processing;

import com.syncpipeline.config.PipelineMetrics;
import com.syncpipeline.config.TraceContextManager;
import com.syncpipeline.logging.LogLevel;
import com.syncpipeline.logging.PipelineLogger;
import com.syncpipeline.model.Chunk;
import com.syncpipeline.model.ChunkOutcome;
import com.syncpipeline.model.RawRecord;
import com.syncpipeline.model.SyncFlags;
import com.syncpipeline.repository.RecordStore;
import com.syncpipeline.repository.StorageException;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Persists one chunk and turns the store's answer into a {@link ChunkOutcome}.
 *
 * A chunk is the unit of atomicity: it is either fully processed or fully skipped
 * with a single ChunkProcessingFailed error. Nothing thrown by the store escapes.
 */
@Service
public class ChunkProcessor {

    private final RecordStore recordStore;
    private final PipelineLogger logger;
    private final PipelineMetrics metrics;

    public ChunkProcessor(RecordStore recordStore, PipelineLogger logger, PipelineMetrics metrics) {
        this.recordStore = recordStore;
        this.logger = logger;
        this.metrics = metrics;
    }

    public ChunkOutcome process(Chunk<RawRecord> chunk, SyncFlags flags) {
        MDC.put(TraceContextManager.CHUNK_INDEX, String.valueOf(chunk.index()));
        long start = System.nanoTime();
        try {
            recordStore.persist(chunk.records(), flags);
            logger.log(LogLevel.DEBUG, "Processed chunk " + chunk.index() + " (" + chunk.size() + " records)");
            return ChunkOutcome.succeeded(chunk);
        } catch (StorageException e) {
            logger.log(LogLevel.ERROR, "Chunk " + chunk.index() + " failed: " + e.reason().description());
            metrics.incrementChunksFailed();
            return ChunkOutcome.failed(chunk, e);
        } catch (RuntimeException e) {
            // store broke its contract; still counted against this chunk only
            logger.log(LogLevel.ERROR, "Chunk " + chunk.index() + " failed with unexpected "
                    + e.getClass().getSimpleName() + ": " + e.getMessage());
            metrics.incrementChunksFailed();
            return ChunkOutcome.failed(chunk, e);
        } finally {
            metrics.recordChunkPersistTime(System.nanoTime() - start);
            MDC.remove(TraceContextManager.CHUNK_INDEX);
        }
    }
}
