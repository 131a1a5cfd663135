package com.hailmary.checkpoint;

import com.hailmary.model.Checkpoint;

import java.time.Instant;

/**
 * Durable, monotonic bookmark per source.
 *
 * <p>Each key has a single writer: the pipeline that owns the source.  Reads for
 * status reporting may happen concurrently from any thread.</p>
 */
public interface CheckpointStore {

    /**
     * Returns the last synced value for {@code sourceId}, or {@link Instant#EPOCH} if none is
     * recorded or the stored state cannot be read.  Never throws.
     */
    Instant get(String sourceId);

    /**
     * Full checkpoint including its write time, for observability.  Never throws.
     */
    Checkpoint describe(String sourceId);

    /**
     * Moves the checkpoint to {@code newValue} if it is not behind the current value.
     *
     * @return {@code true} if the value was stored, {@code false} if it would have moved backward
     * @throws RuntimeException if the store cannot be written; the caller must not treat the batch as committed
     */
    boolean advance(String sourceId, Instant newValue);

    /**
     * Sets the checkpoint back to {@link Instant#EPOCH} so the next poll re-extracts everything.
     * Callers must serialize this with {@link #advance} for the same source.
     */
    void reset(String sourceId);
}
