package com.hailmary.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of one pipeline, as reported on the status surface.
 */
@Value
@Builder
public class PipelineStatus {

    String source;
    String relation;
    String index;
    PipelineState state;
    boolean healthy;

    Instant lastCheckpoint;
    Instant lastCheckpointAt;
    Instant lastSuccessAt;

    String lastError;
    Instant lastErrorAt;
    boolean configurationError;

    long errorCount;
    int consecutiveFailures;
    long cyclesCompleted;
    long documentsLoaded;
    long documentsRejected;
}
