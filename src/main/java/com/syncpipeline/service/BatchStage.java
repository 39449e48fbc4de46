package com.syncpipeline.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one batch submission.
 */
public enum BatchStage {
    IDLE,
    VALIDATING,
    REJECTED,
    CHUNKING,
    PROCESSING,
    AGGREGATING,
    DONE;

    public boolean canAdvanceTo(BatchStage next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == REJECTED || this == DONE;
    }

    private Set<BatchStage> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(REJECTED, CHUNKING);
            case CHUNKING -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(AGGREGATING);
            case AGGREGATING -> EnumSet.of(DONE);
            case REJECTED, DONE -> EnumSet.noneOf(BatchStage.class);
        };
    }
}
