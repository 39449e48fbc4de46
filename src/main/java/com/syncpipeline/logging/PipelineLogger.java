package com.syncpipeline.logging;

/**
 * Logging sink the pipeline reports progress to.
 * Fire-and-forget: implementations must not throw and never influence a batch outcome.
 */
@FunctionalInterface
public interface PipelineLogger {

    void log(LogLevel level, String message);
}
