package com.syncpipeline.model.error;

/**
 * Any error a pipeline result can carry.
 */
public sealed interface PipelineError permits ValidationError, ProcessingError {

    /**
     * Human-readable message, stable for a given error value.
     */
    String description();
}
