package com.hailmary.checkpoint;

import com.hailmary.model.Checkpoint;
import com.hailmary.source.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Checkpoint store backed by a bookkeeping table in the relational store.
 *
 * <pre>
 *   source_id         VARCHAR(128) PRIMARY KEY
 *   last_synced_value TIMESTAMPTZ  NOT NULL
 *   last_synced_at    TIMESTAMPTZ  NOT NULL
 * </pre>
 *
 * <p>Monotonicity is enforced by the upsert itself ({@code WHERE current <= new}), so an
 * out-of-order advance is a no-op even if two writers ever raced.</p>
 */
@Slf4j
public class JdbcCheckpointStore implements CheckpointStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final String table;
    private final Clock clock;

    public JdbcCheckpointStore(NamedParameterJdbcTemplate jdbc, String table) {
        this(jdbc, table, Clock.systemUTC());
    }

    public JdbcCheckpointStore(NamedParameterJdbcTemplate jdbc, String table, Clock clock) {
        this.jdbc = jdbc;
        this.table = SqlIdentifiers.quote(table);
        this.clock = clock;
    }

    /**
     * Creates the checkpoint table if it does not exist.
     */
    public void initialize() {
        jdbc.getJdbcTemplate().execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                + "source_id VARCHAR(128) PRIMARY KEY, "
                + "last_synced_value TIMESTAMPTZ NOT NULL, "
                + "last_synced_at TIMESTAMPTZ NOT NULL)");
        log.info("Checkpoint table {} ready", table);
    }

    @Override
    public Instant get(String sourceId) {
        return describe(sourceId).getLastSyncedValue();
    }

    @Override
    public Checkpoint describe(String sourceId) {
        try {
            List<Checkpoint> rows = jdbc.query(
                    "SELECT source_id, last_synced_value, last_synced_at FROM " + table
                            + " WHERE source_id = :sourceId",
                    new MapSqlParameterSource("sourceId", sourceId),
                    (rs, rowNum) -> new Checkpoint(
                            rs.getString("source_id"),
                            toInstant(rs.getTimestamp("last_synced_value")),
                            toInstant(rs.getTimestamp("last_synced_at"))));
            if (rows.isEmpty() || rows.get(0).getLastSyncedValue() == null) {
                return Checkpoint.initial(sourceId);
            }
            return rows.get(0);
        } catch (DataAccessException e) {
            log.warn("[{}] Failed to read checkpoint from {}, starting from epoch: {}",
                    sourceId, table, e.getMessage());
            return Checkpoint.initial(sourceId);
        }
    }

    @Override
    public boolean advance(String sourceId, Instant newValue) {
        int updated = jdbc.update(
                "INSERT INTO " + table + " AS c (source_id, last_synced_value, last_synced_at) "
                        + "VALUES (:sourceId, :value, :now) "
                        + "ON CONFLICT (source_id) DO UPDATE "
                        + "SET last_synced_value = EXCLUDED.last_synced_value, "
                        + "last_synced_at = EXCLUDED.last_synced_at "
                        + "WHERE c.last_synced_value <= EXCLUDED.last_synced_value",
                params(sourceId, newValue));
        if (updated == 0) {
            log.warn("[{}] Ignoring checkpoint move backward to {}", sourceId, newValue);
            return false;
        }
        return true;
    }

    @Override
    public void reset(String sourceId) {
        jdbc.update(
                "INSERT INTO " + table + " (source_id, last_synced_value, last_synced_at) "
                        + "VALUES (:sourceId, :value, :now) "
                        + "ON CONFLICT (source_id) DO UPDATE "
                        + "SET last_synced_value = EXCLUDED.last_synced_value, "
                        + "last_synced_at = EXCLUDED.last_synced_at",
                params(sourceId, Instant.EPOCH));
    }

    private MapSqlParameterSource params(String sourceId, Instant value) {
        return new MapSqlParameterSource()
                .addValue("sourceId", sourceId)
                .addValue("value", Timestamp.from(value))
                .addValue("now", Timestamp.from(clock.instant()));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
