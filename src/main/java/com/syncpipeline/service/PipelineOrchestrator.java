package com.syncpipeline.service;

import com.syncpipeline.config.PipelineMetrics;
import com.syncpipeline.config.TraceContextManager;
import com.syncpipeline.logging.LogLevel;
import com.syncpipeline.logging.PipelineLogger;
import com.syncpipeline.model.Chunk;
import com.syncpipeline.model.ChunkOutcome;
import com.syncpipeline.model.LooseValue;
import com.syncpipeline.model.PipelineResult;
import com.syncpipeline.model.RawRecord;
import com.syncpipeline.model.SyncFlags;
import com.syncpipeline.model.ValidationResult;
import com.syncpipeline.model.error.PipelineError;
import com.syncpipeline.service.aggregation.OutcomeAggregator;
import com.syncpipeline.service.chunking.Chunker;
import com.syncpipeline.service.processing.ChunkProcessor;
import com.syncpipeline.service.validation.RecordValidator;
import com.syncpipeline.service.worker.SerialChunkWorker;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Entry point of the ingestion pipeline.
 *
 * Per batch:
 * 1. Validate every record   - any defect rejects the batch, storage is never called
 * 2. Split into chunks       - fixed size, order preserved
 * 3. Persist chunk by chunk  - all chunks go to the single serialized worker, FIFO
 * 4. Aggregate               - fold chunk outcomes in chunk order, off the worker thread
 * 5. Deliver                 - continuation runs exactly once on the chosen executor
 *
 * A failing chunk never stops the chunks after it. Batches are not cancellable once accepted.
 */
@Service
public class PipelineOrchestrator {

    private final RecordValidator validator;
    private final Chunker chunker;
    private final ChunkProcessor chunkProcessor;
    private final OutcomeAggregator aggregator;
    private final SerialChunkWorker worker;
    private final PipelineLogger logger;
    private final PipelineMetrics metrics;
    private final Executor callbackExecutor;
    private final Executor completionExecutor;
    private final int chunkSize;

    public PipelineOrchestrator(
            RecordValidator validator,
            Chunker chunker,
            ChunkProcessor chunkProcessor,
            OutcomeAggregator aggregator,
            SerialChunkWorker worker,
            PipelineLogger logger,
            PipelineMetrics metrics,
            @Qualifier("pipelineCallbackExecutor") Executor callbackExecutor,
            @Qualifier("pipelineCompletionExecutor") Executor completionExecutor,
            @Value("${app.pipeline.chunk-size:100}") int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("app.pipeline.chunk-size must be positive, got " + chunkSize);
        }
        this.validator = validator;
        this.chunker = chunker;
        this.chunkProcessor = chunkProcessor;
        this.aggregator = aggregator;
        this.worker = worker;
        this.logger = logger;
        this.metrics = metrics;
        this.callbackExecutor = callbackExecutor;
        this.completionExecutor = completionExecutor;
        this.chunkSize = chunkSize;
    }

    /**
     * Process a batch and deliver the result on the default callback executor.
     */
    public void processBatch(List<? extends LooseValue> records, SyncFlags flags,
                             Consumer<PipelineResult> continuation) {
        processBatch(records, flags, callbackExecutor, continuation);
    }

    /**
     * Process a batch and deliver the result on {@code executor}.
     */
    public void processBatch(List<? extends LooseValue> records, SyncFlags flags,
                             Executor executor, Consumer<PipelineResult> continuation) {
        processBatchAsync(records, flags)
                .thenAcceptAsync(continuation, executor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        logger.log(LogLevel.ERROR, "Batch continuation failed: " + unwrap(error));
                    }
                });
    }

    /**
     * Process a batch. The returned future always completes normally with the batch result,
     * never on the chunk worker thread, so dependent stages cannot stall chunk processing.
     */
    public CompletableFuture<PipelineResult> processBatchAsync(List<? extends LooseValue> records, SyncFlags flags) {
        boolean ownsTrace = MDC.get(TraceContextManager.TRACE_ID) == null;
        BatchRun run = new BatchRun(TraceContextManager.ensureTraceId(), records.size());
        try {
            return start(run, records, flags);
        } finally {
            if (ownsTrace) {
                TraceContextManager.clear();
            }
        }
    }

    private CompletableFuture<PipelineResult> start(BatchRun run, List<? extends LooseValue> records, SyncFlags flags) {
        metrics.incrementBatchesReceived();
        logger.log(LogLevel.INFO, "Starting batch " + run.getBatchId() + " with " + records.size()
                + " records (manualSync=" + flags.manualSync()
                + ", providerManualSync=" + flags.providerManualSync() + ")");

        // STAGE 1: Validation
        run.advance(BatchStage.VALIDATING);
        ValidationResult validation = validator.validate(records);
        if (!validation.isValid()) {
            run.advance(BatchStage.REJECTED);
            metrics.incrementBatchesRejected();
            logger.log(LogLevel.ERROR, "Validation failed: " + describe(validation.errors()));
            return CompletableFuture.completedFuture(
                    new PipelineResult.Failure(List.copyOf(validation.errors())));
        }

        // STAGE 2: Chunking
        run.advance(BatchStage.CHUNKING);
        List<RawRecord> accepted = records.stream()
                .map(value -> RawRecord.of((LooseValue.Mapping) value))
                .toList();
        List<Chunk<RawRecord>> chunks = chunker.split(accepted, chunkSize);
        logger.log(LogLevel.INFO, "Processing " + chunks.size() + " chunks (chunk size " + chunkSize + ")");

        // STAGE 3: Serialized processing
        run.advance(BatchStage.PROCESSING);
        List<CompletableFuture<ChunkOutcome>> pending = chunks.stream()
                .map(chunk -> submit(chunk, flags))
                .toList();

        // STAGE 4: Aggregation, once every chunk has an outcome
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApplyAsync(TraceContextManager.propagate((Void ignored) -> aggregate(run, pending)),
                        completionExecutor);
    }

    private CompletableFuture<ChunkOutcome> submit(Chunk<RawRecord> chunk, SyncFlags flags) {
        try {
            return worker.submit(() -> chunkProcessor.process(chunk, flags))
                    .exceptionally(error -> ChunkOutcome.failed(chunk, unwrap(error)));
        } catch (RejectedExecutionException e) {
            logger.log(LogLevel.ERROR, "Chunk " + chunk.index() + " could not be queued: " + e.getMessage());
            return CompletableFuture.completedFuture(ChunkOutcome.failed(chunk, e));
        }
    }

    private PipelineResult aggregate(BatchRun run, List<CompletableFuture<ChunkOutcome>> pending) {
        run.advance(BatchStage.AGGREGATING);
        List<ChunkOutcome> outcomes = pending.stream()
                .map(CompletableFuture::join)
                .toList();
        PipelineResult result = aggregator.fold(outcomes);
        run.advance(BatchStage.DONE);

        metrics.incrementRecords(result.processedCount(), result.skippedCount());
        metrics.recordBatchTotalTime(run.elapsedMillis());
        report(run, result);
        return result;
    }

    private void report(BatchRun run, PipelineResult result) {
        if (result instanceof PipelineResult.Success success) {
            logger.log(LogLevel.INFO, "Processing completed: " + success.processedCount() + " processed, "
                    + success.skippedCount() + " skipped in " + run.elapsedMillis() + "ms");
        } else if (result instanceof PipelineResult.PartialSuccess partial) {
            logger.log(LogLevel.WARNING, "Processing completed with errors: " + partial.processedCount()
                    + " processed, " + partial.skippedCount() + " skipped, " + partial.errorCount() + " errors");
        } else {
            logger.log(LogLevel.ERROR, "Processing failed: " + result.errorCount() + " errors, "
                    + result.skippedCount() + " skipped");
        }
    }

    private static String describe(List<? extends PipelineError> errors) {
        return errors.stream()
                .map(PipelineError::description)
                .collect(Collectors.joining("; "));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
