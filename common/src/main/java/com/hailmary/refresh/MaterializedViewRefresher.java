package com.hailmary.refresh;

import com.hailmary.config.RefreshConfig;
import com.hailmary.source.RelationalStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the joined materialized view current.
 *
 * <p>The refresher never pushes data to the index.  A refresh only changes what the view
 * pipeline's next poll sees: every refreshed row gets a new value in the view's own
 * tracking column ({@code last_updated}), which is past the view pipeline's checkpoint.</p>
 *
 * <p>A refresh is needed when any base table has a row edited after the view's newest
 * {@code last_updated}.  With {@code alwaysRefresh} the check is skipped and every tick
 * refreshes.</p>
 */
@Slf4j
public class MaterializedViewRefresher {

    private final RefreshConfig config;
    private final RelationalStore store;
    private final Clock clock;

    private Instant lastCheckAt;
    private Instant lastRefreshAt;
    private long refreshCount;
    private long skippedCount;
    private String lastError;
    private long errorCount;

    public MaterializedViewRefresher(RefreshConfig config, RelationalStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Compares the view's last refresh time with the newest edit across the base tables.
     *
     * @return {@code true} if a base table changed after the view was last refreshed
     */
    public synchronized boolean needsRefresh() {
        lastCheckAt = clock.instant();
        Instant viewRefreshedAt = store.maxValue(config.getView(), config.getViewTrackingColumn())
                .orElse(Instant.EPOCH);

        for (RefreshConfig.BaseTable base : config.getBaseTables()) {
            Optional<Instant> baseUpdatedAt = store.maxValue(base.getTable(), base.getTrackingColumn());
            if (baseUpdatedAt.isPresent() && baseUpdatedAt.get().isAfter(viewRefreshedAt)) {
                log.info("Base table '{}' changed at {} after view '{}' refresh at {}",
                        base.getTable(), baseUpdatedAt.get(), config.getView(), viewRefreshedAt);
                return true;
            }
        }
        return false;
    }

    /**
     * Recomputes the view.  Readers keep querying the previous contents while a
     * concurrent refresh runs.
     */
    public synchronized void refresh() {
        long started = System.currentTimeMillis();
        store.refreshMaterializedView(config.getView(), config.isConcurrently());
        lastRefreshAt = clock.instant();
        refreshCount++;
        lastError = null;
        log.info("Refreshed materialized view '{}' in {}ms", config.getView(),
                System.currentTimeMillis() - started);
    }

    /**
     * Refreshes the view if base tables changed (or unconditionally with {@code alwaysRefresh}).
     *
     * @return {@code true} if a refresh was issued
     */
    public synchronized boolean refreshIfNeeded() {
        if (config.isAlwaysRefresh() || needsRefresh()) {
            refresh();
            return true;
        }
        skippedCount++;
        log.debug("View '{}' is current, skipping refresh", config.getView());
        return false;
    }

    /**
     * Scheduler entry point: like {@link #refreshIfNeeded()} but records failures, errors
     * included, instead of throwing.  A throwing task would cancel every later tick.
     */
    public synchronized boolean tick() {
        try {
            return refreshIfNeeded();
        } catch (RuntimeException | Error e) {
            errorCount++;
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            log.error("Failed to refresh materialized view '{}': {}", config.getView(), e.getMessage(), e);
            return false;
        }
    }

    public long getIntervalMs() {
        return config.getIntervalMs();
    }

    public synchronized RefresherStatus status() {
        return RefresherStatus.builder()
                .view(config.getView())
                .enabled(config.isEnabled())
                .healthy(lastError == null)
                .lastCheckAt(lastCheckAt)
                .lastRefreshAt(lastRefreshAt)
                .refreshCount(refreshCount)
                .skippedCount(skippedCount)
                .lastError(lastError)
                .errorCount(errorCount)
                .build();
    }
}
