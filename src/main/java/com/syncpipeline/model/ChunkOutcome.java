package com.syncpipeline.model;

import com.syncpipeline.model.error.ProcessingError;

import java.util.List;

/**
 * Result of persisting one chunk. A chunk succeeds or fails as a unit.
 */
public record ChunkOutcome(
    int processedCount,
    int skippedCount,
    List<ProcessingError> errors
) {
    public ChunkOutcome {
        if (processedCount < 0 || skippedCount < 0) {
            throw new IllegalArgumentException(
                    "Counts must be non-negative: processed=" + processedCount + ", skipped=" + skippedCount);
        }
        errors = List.copyOf(errors);
    }

    public static ChunkOutcome succeeded(Chunk<?> chunk) {
        return new ChunkOutcome(chunk.size(), 0, List.of());
    }

    public static ChunkOutcome failed(Chunk<?> chunk, Throwable cause) {
        return new ChunkOutcome(0, chunk.size(),
                List.of(new ProcessingError.ChunkProcessingFailed(chunk.index(), cause)));
    }

    public int totalCount() {
        return processedCount + skippedCount;
    }
}
