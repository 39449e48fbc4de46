package com.syncpipeline.config;

import com.syncpipeline.service.worker.SerialChunkWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors used by the pipeline.
 *
 * Chunk writes go through one serialized worker so the record store never sees
 * overlapping writes. Batch futures complete, and continuations run, on separate
 * threads so a slow caller never holds up the next chunk.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.pipeline.worker.shutdown-timeout-seconds:30}")
    private long shutdownTimeoutSeconds;

    @Bean(destroyMethod = "close")
    public SerialChunkWorker chunkWorker() {
        log.info("Creating serialized chunk worker");
        return new SerialChunkWorker("chunk-worker", Duration.ofSeconds(shutdownTimeoutSeconds));
    }

    @Bean(name = "callbackExecutorService", destroyMethod = "shutdown")
    public ExecutorService callbackExecutorService() {
        log.info("Creating pipeline callback executor");
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-callback");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Completes batch futures off the chunk worker. Cached so a caller blocking inside a
     * dependent stage never holds up the completion of another batch.
     */
    @Bean(name = "pipelineCompletionExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineCompletionExecutor() {
        log.info("Creating pipeline completion executor");
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-completion-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Default context continuations are delivered on, with MDC propagation.
     */
    @Bean("pipelineCallbackExecutor")
    public Executor pipelineCallbackExecutor(
            @Qualifier("callbackExecutorService") ExecutorService callbackExecutorService) {
        return command -> callbackExecutorService.execute(TraceContextManager.propagate(command));
    }
}
