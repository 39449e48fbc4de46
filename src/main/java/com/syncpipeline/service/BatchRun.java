package com.syncpipeline.service;

import lombok.Getter;

/**
 * Tracks one batch through its {@link BatchStage}s. Stage changes may come from the
 * submitting thread or the chunk worker, so transitions are synchronized.
 */
@Getter
public class BatchRun {

    private final String batchId;
    private final int recordCount;
    private final long startedAtMillis;
    private BatchStage stage = BatchStage.IDLE;

    public BatchRun(String batchId, int recordCount) {
        this.batchId = batchId;
        this.recordCount = recordCount;
        this.startedAtMillis = System.currentTimeMillis();
    }

    /**
     * @throws IllegalStateException when {@code next} does not follow the current stage
     */
    public synchronized void advance(BatchStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Batch " + batchId + " cannot move from " + stage + " to " + next);
        }
        stage = next;
    }

    public synchronized BatchStage getStage() {
        return stage;
    }

    public long elapsedMillis() {
        return System.currentTimeMillis() - startedAtMillis;
    }
}
