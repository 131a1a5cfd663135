package com.hailmary.source;

import com.hailmary.config.SourceConfig;
import com.hailmary.exception.SyncConfigurationException;
import com.hailmary.model.ExtractionCursor;
import com.hailmary.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of {@link RelationalStore} on top of Spring JDBC.
 *
 * <p>Incremental reads use keyset pagination over {@code (tracking column, primary key...)}:
 * <pre>
 *   SELECT * FROM "Prospect"
 *   WHERE "updatedAt" &gt; :trackingValue
 *      OR ("updatedAt" = :trackingValue AND ("id" &gt; :key0 OR "id" IS NULL))
 *   ORDER BY "updatedAt" ASC, "id" ASC NULLS LAST
 *   LIMIT :limit
 * </pre>
 * The first page of a cycle has no key yet and uses {@code "updatedAt" > :trackingValue}.
 * Key columns may hold {@code NULL} (a company without prospects in a join view), so the
 * comparison is spelled out per column instead of a row-value {@code >}, which would drop
 * those rows.</p>
 *
 * <p>Query timeouts are configured on the underlying {@code JdbcTemplate}.</p>
 */
@Slf4j
public class JdbcRelationalStore implements RelationalStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final ColumnMapRowMapper rowMapper = new ColumnMapRowMapper();

    public JdbcRelationalStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<SourceRecord> fetchPage(SourceConfig source, ExtractionCursor after, int limit) {
        String sql = buildPageQuery(source, after);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("trackingValue", Timestamp.from(after.getTrackingValue()))
                .addValue("limit", limit);
        if (after.hasPrimaryKey()) {
            List<Object> key = after.getPrimaryKey();
            for (int i = 0; i < key.size(); i++) {
                if (key.get(i) != null) {
                    params.addValue("key" + i, key.get(i));
                }
            }
        }

        log.debug("[{}] Extracting page after {}: {}", source.getName(), after, sql);
        List<Map<String, Object>> rows = jdbc.query(sql, params, rowMapper);

        List<SourceRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(toRecord(source, row));
        }
        return records;
    }

    static String buildPageQuery(SourceConfig source, ExtractionCursor after) {
        String relation = SqlIdentifiers.quote(source.getRelation());
        String tracking = SqlIdentifiers.quote(source.getTrackingColumn());
        List<String> keyColumns = source.getPrimaryKey().stream().map(SqlIdentifiers::quote).toList();

        String where = tracking + " > :trackingValue";
        if (after.hasPrimaryKey()) {
            where += " OR (" + tracking + " = :trackingValue AND " + keyAfter(keyColumns, after.getPrimaryKey()) + ")";
        }

        StringBuilder orderBy = new StringBuilder(tracking).append(" ASC");
        for (String keyColumn : keyColumns) {
            orderBy.append(", ").append(keyColumn).append(" ASC NULLS LAST");
        }

        return "SELECT * FROM " + relation
                + " WHERE " + where
                + " ORDER BY " + orderBy
                + " LIMIT :limit";
    }

    /**
     * Lexicographic "key after cursor" with {@code NULL} ordered last: one disjunct per key
     * column, equal on the columns before it and greater on itself.
     */
    private static String keyAfter(List<String> keyColumns, List<Object> cursorKey) {
        List<String> disjuncts = new ArrayList<>();
        List<String> equalPrefix = new ArrayList<>();
        for (int i = 0; i < keyColumns.size(); i++) {
            String column = keyColumns.get(i);
            boolean nullAtCursor = cursorKey.get(i) == null;
            // nothing sorts after NULL in this column
            if (!nullAtCursor) {
                List<String> conjuncts = new ArrayList<>(equalPrefix);
                conjuncts.add("(" + column + " > :key" + i + " OR " + column + " IS NULL)");
                disjuncts.add(String.join(" AND ", conjuncts));
            }
            equalPrefix.add(nullAtCursor ? column + " IS NULL" : column + " = :key" + i);
        }
        if (disjuncts.isEmpty()) {
            return "FALSE";
        }
        return disjuncts.size() == 1
                ? disjuncts.get(0)
                : "(" + disjuncts.stream().map(d -> "(" + d + ")").collect(Collectors.joining(" OR ")) + ")";
    }

    private SourceRecord toRecord(SourceConfig source, Map<String, Object> row) {
        if (!row.containsKey(source.getTrackingColumn()) || !row.keySet().containsAll(source.getPrimaryKey())) {
            throw new SyncConfigurationException(source.getName(), "Row of " + source.getRelation()
                    + " has no column '" + source.getTrackingColumn() + "' or " + source.getPrimaryKey());
        }
        List<Object> primaryKey = new ArrayList<>(source.getPrimaryKey().size());
        for (String keyColumn : source.getPrimaryKey()) {
            primaryKey.add(row.get(keyColumn));
        }
        if (primaryKey.stream().allMatch(Objects::isNull)) {
            throw new SyncConfigurationException(source.getName(), "Null primary key '"
                    + String.join(", ", source.getPrimaryKey()) + "' in " + source.getRelation());
        }
        return SourceRecord.builder()
                .primaryKey(primaryKey)
                .documentId(SourceRecord.documentIdOf(primaryKey))
                .trackingValue(toInstant(source, row.get(source.getTrackingColumn())))
                .columns(new LinkedHashMap<>(row))
                .build();
    }

    static Instant toInstant(SourceConfig source, Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof LocalDateTime localDateTime) {
            // same zone conversion the driver applies when binding Timestamp parameters
            return Timestamp.valueOf(localDateTime).toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        throw new SyncConfigurationException(source.getName(), "Tracking column '" + source.getTrackingColumn()
                + "' of " + source.getRelation() + " is not a timestamp: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    @Override
    public Optional<Instant> maxValue(String relation, String column) {
        String sql = "SELECT MAX(" + SqlIdentifiers.quote(column) + ") FROM " + SqlIdentifiers.quote(relation);
        Timestamp max = jdbc.getJdbcTemplate().queryForObject(sql, Timestamp.class);
        return Optional.ofNullable(max).map(Timestamp::toInstant);
    }

    @Override
    public long countRows(String relation) {
        Long count = jdbc.getJdbcTemplate()
                .queryForObject("SELECT COUNT(*) FROM " + SqlIdentifiers.quote(relation), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<String> listColumns(String relation) {
        // pg_attribute also covers materialized views, which information_schema.columns omits
        String schema = SqlIdentifiers.schemaName(relation);
        MapSqlParameterSource params = new MapSqlParameterSource("relation", SqlIdentifiers.simpleName(relation));
        String sql = "SELECT a.attname FROM pg_attribute a "
                + "JOIN pg_class c ON a.attrelid = c.oid "
                + "JOIN pg_namespace n ON n.oid = c.relnamespace "
                + "WHERE c.relname = :relation AND a.attnum > 0 AND NOT a.attisdropped ";
        if (schema != null) {
            sql += "AND n.nspname = :schema ";
            params.addValue("schema", schema);
        } else {
            sql += "AND pg_table_is_visible(c.oid) ";
        }
        sql += "ORDER BY a.attnum";
        return jdbc.queryForList(sql, params, String.class);
    }

    @Override
    public void refreshMaterializedView(String view, boolean concurrently) {
        String sql = "REFRESH MATERIALIZED VIEW " + (concurrently ? "CONCURRENTLY " : "")
                + SqlIdentifiers.quote(view);
        jdbc.getJdbcTemplate().execute(sql);
    }

    @Override
    public boolean ping() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (DataAccessException e) {
            log.warn("Relational store ping failed: {}", e.getMessage());
            return false;
        }
    }
}
