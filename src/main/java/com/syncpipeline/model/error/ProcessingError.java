package com.syncpipeline.model.error;

import java.util.Objects;

/**
 * Failure recorded after a side effect was attempted.
 */
public sealed interface ProcessingError extends PipelineError {

    record ChunkProcessingFailed(int chunkIndex, Throwable cause) implements ProcessingError {
        public ChunkProcessingFailed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String description() {
            return "Chunk " + chunkIndex + " processing failed: " + cause.getMessage();
        }
    }

    record StorageSaveFailed(Throwable cause) implements ProcessingError {
        public StorageSaveFailed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String description() {
            return "Storage save failed: " + cause.getMessage();
        }
    }

    record DuplicateKey(String key) implements ProcessingError {
        @Override
        public String description() {
            return "Duplicate key: " + key;
        }
    }
}
