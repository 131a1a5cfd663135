package com.hailmary.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hailmary.model.Checkpoint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;

/**
 * File-backed checkpoint store.
 *
 * Path format:
 *   &lt;directory&gt;/&lt;source-id&gt;_last_run.json
 *
 * <p>Writes go to a temporary file that is then moved over the target, so a crash
 * mid-write leaves the previous checkpoint intact.</p>
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private static final String SUFFIX = "_last_run.json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileCheckpointStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileCheckpointStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Creates the checkpoint directory if it does not exist.
     */
    public void initialize() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create checkpoint directory " + directory, e);
        }
    }

    @Override
    public Instant get(String sourceId) {
        return describe(sourceId).getLastSyncedValue();
    }

    @Override
    public synchronized Checkpoint describe(String sourceId) {
        Path file = checkpointFile(sourceId);
        if (!Files.exists(file)) {
            return Checkpoint.initial(sourceId);
        }
        try {
            Checkpoint checkpoint = objectMapper.readValue(file.toFile(), Checkpoint.class);
            if (checkpoint.getLastSyncedValue() == null) {
                log.warn("[{}] Checkpoint file {} has no value, starting from epoch", sourceId, file);
                return Checkpoint.initial(sourceId);
            }
            return checkpoint;
        } catch (IOException e) {
            log.warn("[{}] Failed to read checkpoint {}, starting from epoch: {}", sourceId, file, e.getMessage());
            return Checkpoint.initial(sourceId);
        }
    }

    @Override
    public synchronized boolean advance(String sourceId, Instant newValue) {
        Instant current = get(sourceId);
        if (newValue.isBefore(current)) {
            log.warn("[{}] Ignoring checkpoint move backward: {} -> {}", sourceId, current, newValue);
            return false;
        }
        write(new Checkpoint(sourceId, newValue, clock.instant()));
        return true;
    }

    @Override
    public synchronized void reset(String sourceId) {
        write(new Checkpoint(sourceId, Instant.EPOCH, clock.instant()));
    }

    private void write(Checkpoint checkpoint) {
        Path target = checkpointFile(checkpoint.getSourceId());
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, checkpoint.getSourceId(), ".tmp");
            objectMapper.writeValue(temp.toFile(), checkpoint);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save checkpoint for source " + checkpoint.getSourceId(), e);
        }
    }

    private Path checkpointFile(String sourceId) {
        return directory.resolve(sourceId + SUFFIX);
    }
}
