package com.hailmary.pipeline;

import com.hailmary.config.SourceConfig;
import com.hailmary.exception.SyncException;

import java.time.Clock;
import java.time.Instant;

/**
 * Mutable runtime state of one pipeline.  Written only by the pipeline's own thread;
 * read from any thread through {@link #snapshot()}.
 */
public class PipelineContext {

    private final SourceConfig source;
    private final Clock clock;

    private PipelineState state = PipelineState.IDLE;
    private Instant lastCheckpoint = Instant.EPOCH;
    private Instant lastCheckpointAt;
    private Instant lastSuccessAt;
    private String lastError;
    private Instant lastErrorAt;
    private boolean configurationError;
    private long errorCount;
    private int consecutiveFailures;
    private long cyclesCompleted;
    private long documentsLoaded;
    private long documentsRejected;

    public PipelineContext(SourceConfig source, Clock clock) {
        this.source = source;
        this.clock = clock;
    }

    public synchronized PipelineState getState() {
        return state;
    }

    public synchronized void transition(PipelineState next) {
        this.state = next;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized void checkpointRead(Instant value) {
        this.lastCheckpoint = value;
    }

    public synchronized void checkpointAdvanced(Instant value) {
        this.lastCheckpoint = value;
        this.lastCheckpointAt = clock.instant();
    }

    public synchronized void documentsLoaded(int loaded, int rejected) {
        this.documentsLoaded += loaded;
        this.documentsRejected += rejected;
    }

    public synchronized void cycleSucceeded() {
        this.state = PipelineState.IDLE;
        this.lastSuccessAt = clock.instant();
        this.consecutiveFailures = 0;
        this.configurationError = false;
        this.cyclesCompleted++;
    }

    public synchronized void cycleFailed(SyncException failure) {
        this.state = PipelineState.ERROR;
        this.lastError = failure.getMessage();
        this.lastErrorAt = clock.instant();
        this.configurationError = !failure.isTransient();
        this.errorCount++;
        this.consecutiveFailures++;
    }

    public synchronized PipelineStatus snapshot() {
        return PipelineStatus.builder()
                .source(source.getName())
                .relation(source.getRelation())
                .index(source.getIndex())
                .state(state)
                .healthy(state != PipelineState.ERROR && consecutiveFailures == 0)
                .lastCheckpoint(lastCheckpoint)
                .lastCheckpointAt(lastCheckpointAt)
                .lastSuccessAt(lastSuccessAt)
                .lastError(lastError)
                .lastErrorAt(lastErrorAt)
                .configurationError(configurationError)
                .errorCount(errorCount)
                .consecutiveFailures(consecutiveFailures)
                .cyclesCompleted(cyclesCompleted)
                .documentsLoaded(documentsLoaded)
                .documentsRejected(documentsRejected)
                .build();
    }
}
