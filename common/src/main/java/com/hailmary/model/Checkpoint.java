package com.hailmary.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last synchronized tracking-column value of one source.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private String sourceId;

    /** Highest tracking value known to be fully loaded into the index. */
    private Instant lastSyncedValue;

    /** Wall-clock time the checkpoint was last written, {@code null} if never. */
    private Instant lastSyncedAt;

    public static Checkpoint initial(String sourceId) {
        return new Checkpoint(sourceId, Instant.EPOCH, null);
    }
}
