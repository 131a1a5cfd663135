package com.hailmary.checkpoint;

import com.hailmary.model.Checkpoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store kept in process memory.  A restart resyncs every source from epoch.
 */
@Slf4j
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCheckpointStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant get(String sourceId) {
        return describe(sourceId).getLastSyncedValue();
    }

    @Override
    public Checkpoint describe(String sourceId) {
        Checkpoint checkpoint = checkpoints.get(sourceId);
        return checkpoint != null ? checkpoint : Checkpoint.initial(sourceId);
    }

    @Override
    public boolean advance(String sourceId, Instant newValue) {
        boolean[] stored = {false};
        checkpoints.compute(sourceId, (id, current) -> {
            Instant currentValue = current != null ? current.getLastSyncedValue() : Instant.EPOCH;
            if (newValue.isBefore(currentValue)) {
                log.warn("[{}] Ignoring checkpoint move backward: {} -> {}", id, currentValue, newValue);
                return current;
            }
            stored[0] = true;
            return new Checkpoint(id, newValue, clock.instant());
        });
        return stored[0];
    }

    @Override
    public void reset(String sourceId) {
        checkpoints.put(sourceId, new Checkpoint(sourceId, Instant.EPOCH, clock.instant()));
    }
}
