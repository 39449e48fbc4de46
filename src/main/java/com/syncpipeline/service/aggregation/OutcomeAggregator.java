package com.syncpipeline.service.aggregation;

import com.syncpipeline.model.ChunkOutcome;
import com.syncpipeline.model.PipelineResult;
import com.syncpipeline.model.error.PipelineError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds per-chunk outcomes, in chunk order, into one batch result.
 *
 * no errors                     → Success
 * errors and something persisted → PartialSuccess
 * errors and nothing persisted  → Failure
 */
@Component
public class OutcomeAggregator {

    public PipelineResult fold(List<ChunkOutcome> outcomes) {
        int processed = 0;
        int skipped = 0;
        List<PipelineError> errors = new ArrayList<>();

        for (ChunkOutcome outcome : outcomes) {
            processed += outcome.processedCount();
            skipped += outcome.skippedCount();
            errors.addAll(outcome.errors());
        }

        if (errors.isEmpty()) {
            return new PipelineResult.Success(processed, skipped);
        }
        if (processed > 0) {
            return new PipelineResult.PartialSuccess(processed, skipped, errors);
        }
        return new PipelineResult.Failure(errors, skipped);
    }
}
