package com.syncpipeline.model;

import com.syncpipeline.model.error.PipelineError;

import java.util.List;

/**
 * Final outcome of one batch submission.
 *
 * Callers tell the three cases apart by variant alone:
 * - {@link Success}        every record was persisted
 * - {@link PartialSuccess} some chunks persisted, some failed
 * - {@link Failure}        nothing persisted (validation rejection or every chunk failed)
 */
public sealed interface PipelineResult
        permits PipelineResult.Success, PipelineResult.PartialSuccess, PipelineResult.Failure {

    List<PipelineError> errors();

    /**
     * True when at least part of the batch made it to storage, or the batch was empty.
     */
    default boolean isSuccessful() {
        return !(this instanceof Failure);
    }

    default int processedCount() {
        return 0;
    }

    default int skippedCount() {
        return 0;
    }

    default int errorCount() {
        return errors().size();
    }

    record Success(int processedCount, int skippedCount) implements PipelineResult {
        @Override
        public List<PipelineError> errors() {
            return List.of();
        }
    }

    record PartialSuccess(int processedCount, int skippedCount, List<PipelineError> errors)
            implements PipelineResult {
        public PartialSuccess {
            errors = List.copyOf(errors);
        }
    }

    /**
     * {@code skippedCount} is the number of records in chunks that failed; it is 0 for a
     * batch rejected by validation, where nothing was attempted.
     */
    record Failure(List<PipelineError> errors, int skippedCount) implements PipelineResult {
        public Failure {
            errors = List.copyOf(errors);
        }

        public Failure(List<PipelineError> errors) {
            this(errors, 0);
        }
    }
}
