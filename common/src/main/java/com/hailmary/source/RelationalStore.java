package com.hailmary.source;

import com.hailmary.config.SourceConfig;
import com.hailmary.model.ExtractionCursor;
import com.hailmary.model.SourceRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the relational system of record, plus materialized view maintenance.
 *
 * <p>All identifiers are taken verbatim from configuration; implementations must match
 * them case-sensitively.</p>
 */
public interface RelationalStore {

    /**
     * Reads up to {@code limit} rows of {@code source} positioned strictly after {@code after},
     * ordered by tracking column ascending, then primary key ascending.
     */
    List<SourceRecord> fetchPage(SourceConfig source, ExtractionCursor after, int limit);

    /**
     * Maximum value of {@code column} in {@code relation}, empty if the relation has no rows.
     */
    Optional<Instant> maxValue(String relation, String column);

    long countRows(String relation);

    /**
     * Column names of {@code relation} with their stored casing, empty if the relation does not exist.
     */
    List<String> listColumns(String relation);

    /**
     * Recomputes a materialized view.  With {@code concurrently}, readers keep querying the
     * previous contents until the refresh commits.
     */
    void refreshMaterializedView(String view, boolean concurrently);

    /** @return {@code true} if the store answers a trivial query. */
    boolean ping();
}
