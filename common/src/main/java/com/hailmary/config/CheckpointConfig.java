package com.hailmary.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where pipelines persist their checkpoints.
 */
@Data
@NoArgsConstructor
public class CheckpointConfig {

    private CheckpointStoreType type = CheckpointStoreType.JDBC;

    /** Bookkeeping table used by {@link CheckpointStoreType#JDBC}. */
    private String table = "sync_checkpoint";

    /** Directory used by {@link CheckpointStoreType#FILE}. */
    private String directory = "data/checkpoints";

    /** Create the checkpoint table (or directory) on startup when missing. */
    private boolean initializeSchema = true;
}
