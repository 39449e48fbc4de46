package com.syncpipeline.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchRunTest {

    @Test
    @DisplayName("Accepted batch walks every stage up to DONE")
    void acceptedBatchReachesDone() {
        BatchRun run = new BatchRun("b-1", 3);

        run.advance(BatchStage.VALIDATING);
        run.advance(BatchStage.CHUNKING);
        run.advance(BatchStage.PROCESSING);
        run.advance(BatchStage.AGGREGATING);
        run.advance(BatchStage.DONE);

        assertThat(run.getStage()).isEqualTo(BatchStage.DONE);
        assertThat(run.getStage().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Rejected batch stops after validation")
    void rejectedBatchIsTerminal() {
        BatchRun run = new BatchRun("b-2", 1);
        run.advance(BatchStage.VALIDATING);
        run.advance(BatchStage.REJECTED);

        assertThatThrownBy(() -> run.advance(BatchStage.CHUNKING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("REJECTED");
    }

    @Test
    @DisplayName("Skipping validation is not allowed")
    void cannotSkipValidation() {
        BatchRun run = new BatchRun("b-3", 1);

        assertThatThrownBy(() -> run.advance(BatchStage.PROCESSING))
                .isInstanceOf(IllegalStateException.class);
        assertThat(run.getStage()).isEqualTo(BatchStage.IDLE);
    }
}
