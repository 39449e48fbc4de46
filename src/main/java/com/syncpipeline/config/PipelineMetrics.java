package com.syncpipeline.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the ingestion pipeline.
 *
 * Key metrics:
 * - pipeline.batches.received  → batches submitted
 * - pipeline.batches.rejected  → batches that failed validation
 * - pipeline.records.processed → records persisted
 * - pipeline.records.skipped   → records in failed chunks
 * - pipeline.chunks.failed     → chunks the store rejected
 * - pipeline.chunk.persist     → store call time per chunk
 * - pipeline.batch.total       → submit-to-result time per accepted batch
 */
@Component
@Getter
public class PipelineMetrics {

    private final Timer chunkPersistTimer;
    private final Timer batchTotalTimer;

    private final Counter batchesReceivedCounter;
    private final Counter batchesRejectedCounter;
    private final Counter recordsProcessedCounter;
    private final Counter recordsSkippedCounter;
    private final Counter chunksFailedCounter;

    public PipelineMetrics(MeterRegistry registry) {
        this.chunkPersistTimer = Timer.builder("pipeline.chunk.persist")
                .description("Record store call time per chunk")
                .register(registry);

        this.batchTotalTimer = Timer.builder("pipeline.batch.total")
                .description("Submit-to-result time for accepted batches")
                .register(registry);

        this.batchesReceivedCounter = Counter.builder("pipeline.batches.received")
                .description("Batches submitted to the pipeline")
                .register(registry);

        this.batchesRejectedCounter = Counter.builder("pipeline.batches.rejected")
                .description("Batches rejected by validation")
                .register(registry);

        this.recordsProcessedCounter = Counter.builder("pipeline.records.processed")
                .description("Records persisted")
                .register(registry);

        this.recordsSkippedCounter = Counter.builder("pipeline.records.skipped")
                .description("Records skipped because their chunk failed")
                .register(registry);

        this.chunksFailedCounter = Counter.builder("pipeline.chunks.failed")
                .description("Chunks the record store failed to persist")
                .register(registry);
    }

    public void recordChunkPersistTime(long nanos) {
        chunkPersistTimer.record(nanos, TimeUnit.NANOSECONDS);
    }

    public void recordBatchTotalTime(long millis) {
        batchTotalTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementBatchesReceived() {
        batchesReceivedCounter.increment();
    }

    public void incrementBatchesRejected() {
        batchesRejectedCounter.increment();
    }

    public void incrementRecords(int processed, int skipped) {
        recordsProcessedCounter.increment(processed);
        recordsSkippedCounter.increment(skipped);
    }

    public void incrementChunksFailed() {
        chunksFailedCounter.increment();
    }
}
