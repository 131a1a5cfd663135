package com.hailmary.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of one {@link SyncPipeline#runCycle()} call.
 */
@Data
@AllArgsConstructor
public class CycleResult {

    public enum Outcome {
        /** Every extracted row was loaded; the checkpoint reflects the whole backlog. */
        SUCCESS,
        /** Some documents were rejected; the checkpoint stopped before the first rejection. */
        PARTIAL,
        /** Extraction, transformation, loading or checkpointing failed. */
        FAILED,
        /** A stop was requested before the cycle completed. */
        ABORTED
    }

    private final Outcome outcome;
    private final int rowsExtracted;
    private final int documentsLoaded;
    private final Instant checkpoint;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
