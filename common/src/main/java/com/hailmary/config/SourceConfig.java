package com.hailmary.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a single data source and the pipeline that syncs it.
 * Each source reads exactly one relation and writes exactly one index.
 *
 * <p>Identifiers ({@code relation}, {@code primaryKey}, {@code trackingColumn}) are used
 * verbatim and always quoted in generated SQL, so they must carry the exact casing the
 * database stores: {@code "updatedAt"} and {@code updatedat} are different columns.</p>
 *
 * <p>The primary key may span several columns, e.g. {@code [company_id, prospect_id]} for
 * a join view; their values, in order, make up the document id.</p>
 */
@Data
@NoArgsConstructor
public class SourceConfig {

    /** Logical source name, also the checkpoint key (e.g. {@code prospect}). */
    private String name;

    /** Table or materialized view to read (e.g. {@code Prospect}). */
    private String relation;

    private List<String> primaryKey = new ArrayList<>(List.of("id"));

    /** Timestamp column bounding incremental reads (e.g. {@code updatedAt}). */
    private String trackingColumn;

    /** Destination index, dedicated to this source. */
    private String index;

    /** Fully-qualified {@link com.hailmary.transform.DocumentTransformer} class; defaults to a column copy. */
    private String transformerClassName;

    /** Maximum rows extracted per page. */
    private int batchSize = 1000;

    /** Delay between the end of one cycle and the start of the next. */
    private long pollIntervalMs = 30_000;

    private boolean enabled = true;

    private Map<String, String> properties = new HashMap<>();

    public String getProperty(String key) {
        return properties.get(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }
}
