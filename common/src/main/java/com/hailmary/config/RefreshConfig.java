package com.hailmary.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the materialized view refresher.
 */
@Data
@NoArgsConstructor
public class RefreshConfig {

    private boolean enabled = true;

    private String view = "company_prospect_view";

    /** The view's own refresh timestamp column; never a base-table column. */
    private String viewTrackingColumn = "last_updated";

    private List<BaseTable> baseTables = new ArrayList<>();

    private long intervalMs = 10_000;

    /** Use {@code REFRESH ... CONCURRENTLY} so readers keep seeing the old version. */
    private boolean concurrently = true;

    /** Refresh on every tick without consulting {@code needsRefresh()}. */
    private boolean alwaysRefresh = false;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BaseTable {
        private String table;
        private String trackingColumn;
    }
}
