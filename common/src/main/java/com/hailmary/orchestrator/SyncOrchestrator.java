package com.hailmary.orchestrator;

import com.hailmary.checkpoint.CheckpointStore;
import com.hailmary.config.SourceConfig;
import com.hailmary.config.SyncConfig;
import com.hailmary.elasticsearch.IndexWriter;
import com.hailmary.pipeline.BackoffPolicy;
import com.hailmary.pipeline.CycleResult;
import com.hailmary.pipeline.PipelineStatus;
import com.hailmary.pipeline.SyncPipeline;
import com.hailmary.refresh.MaterializedViewRefresher;
import com.hailmary.refresh.RefresherStatus;
import com.hailmary.source.RelationalStore;
import com.hailmary.transform.TransformerFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Supervises the sync pipelines and the materialized view refresher.
 *
 * <p>Each pipeline runs on its own single-thread scheduler, so a failing or slow source
 * never delays another.  A pipeline reschedules itself after every cycle: after the poll
 * interval on success, after exponential backoff on failure.  Cycles of one pipeline
 * therefore never overlap.</p>
 *
 * <p>The orchestrator owns no sync logic; it starts, stops, reports and forwards
 * administrative actions (reset, trigger, refresh) to the owning component.</p>
 */
@Slf4j
public class SyncOrchestrator {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Map<String, SyncPipeline> pipelines = new LinkedHashMap<>();
    private final MaterializedViewRefresher refresher;
    private final RelationalStore store;
    private final IndexWriter indexWriter;
    private final Clock clock;

    private final Map<String, ScheduledExecutorService> executors = new ConcurrentHashMap<>();
    private ScheduledExecutorService refreshExecutor;
    private volatile boolean running;
    private volatile boolean stopped;

    public SyncOrchestrator(Collection<SyncPipeline> pipelines,
                            MaterializedViewRefresher refresher,
                            RelationalStore store,
                            IndexWriter indexWriter,
                            Clock clock) {
        for (SyncPipeline pipeline : pipelines) {
            if (this.pipelines.put(pipeline.getName(), pipeline) != null) {
                throw new IllegalStateException("Duplicate pipeline for source " + pipeline.getName());
            }
        }
        this.refresher = refresher;
        this.store = store;
        this.indexWriter = indexWriter;
        this.clock = clock;
    }

    /**
     * Builds one pipeline per enabled source, and the refresher if enabled.
     */
    public static SyncOrchestrator fromConfig(SyncConfig config,
                                              RelationalStore store,
                                              IndexWriter indexWriter,
                                              CheckpointStore checkpointStore,
                                              Clock clock) {
        config.validate();
        BackoffPolicy backoff = new BackoffPolicy(config.getRetry());
        List<SyncPipeline> pipelines = new ArrayList<>();
        for (SourceConfig source : config.getEnabledSources()) {
            pipelines.add(new SyncPipeline(source, store, TransformerFactory.create(source),
                    indexWriter, checkpointStore, backoff, clock));
        }
        MaterializedViewRefresher refresher = config.getRefresh().isEnabled()
                ? new MaterializedViewRefresher(config.getRefresh(), store, clock)
                : null;
        log.info("Configured {} pipeline(s): {}, view refresher {}", pipelines.size(),
                pipelines.stream().map(SyncPipeline::getName).toList(),
                refresher != null ? "enabled" : "disabled");
        return new SyncOrchestrator(pipelines, refresher, store, indexWriter, clock);
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        stopped = false;
        for (SyncPipeline pipeline : pipelines.values()) {
            pipeline.clearStop();
            ScheduledExecutorService executor = singleThreadScheduler("sync-" + pipeline.getName());
            executors.put(pipeline.getName(), executor);
            scheduleNext(pipeline, executor, 0);
        }
        if (refresher != null) {
            refreshExecutor = singleThreadScheduler("sync-view-refresher");
            refreshExecutor.scheduleWithFixedDelay(refresher::tick, 0, refresher.getIntervalMs(),
                    TimeUnit.MILLISECONDS);
        }
        log.info("Started {} sync pipeline(s)", pipelines.size());
    }

    private void scheduleNext(SyncPipeline pipeline, ScheduledExecutorService executor, long delayMs) {
        if (!running) {
            return;
        }
        try {
            executor.schedule(() -> {
                CycleResult result = null;
                try {
                    result = runSupervised(pipeline);
                } finally {
                    scheduleNext(pipeline, executor, pipeline.nextDelayMs(result));
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Executor shut down, not rescheduling", pipeline.getName());
        }
    }

    /**
     * Supervision boundary: nothing a cycle throws, {@link Error}s included, may end the
     * pipeline's polling loop.
     */
    private CycleResult runSupervised(SyncPipeline pipeline) {
        try {
            return pipeline.runCycle();
        } catch (Throwable t) {
            log.error("[{}] Unexpected failure escaped the pipeline cycle", pipeline.getName(), t);
            return pipeline.cycleEscaped(t);
        }
    }

    /**
     * Requests every pipeline to stop, then waits for in-flight cycles.  A cycle cut short
     * leaves its checkpoint at the last committed page.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        stopped = true;
        pipelines.values().forEach(SyncPipeline::requestStop);

        List<ScheduledExecutorService> all = new ArrayList<>(executors.values());
        if (refreshExecutor != null) {
            all.add(refreshExecutor);
        }
        all.forEach(ScheduledExecutorService::shutdown);
        for (ScheduledExecutorService executor : all) {
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Timeout waiting for sync threads to finish, attempting shutdownNow");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        executors.clear();
        refreshExecutor = null;
        pipelines.values().forEach(SyncPipeline::markStopped);
        log.info("Stopped all sync pipelines");
    }

    public boolean isRunning() {
        return running;
    }

    // ── Observability ────────────────────────────────────────────────────

    /**
     * Pipeline and refresher state plus a live connectivity check of the relational store
     * and the index.  Healthy only if every part is.
     */
    public SyncStatusReport status() {
        List<PipelineStatus> statuses = pipelines.values().stream().map(SyncPipeline::status).toList();
        RefresherStatus refresherStatus = refresher != null ? refresher.status() : null;
        boolean sourceReachable = store.ping();
        boolean indexReachable = indexWriter.ping();
        if (!sourceReachable || !indexReachable) {
            log.warn("Connectivity check failed: relational store {}, index {}",
                    sourceReachable ? "up" : "down", indexReachable ? "up" : "down");
        }
        boolean healthy = sourceReachable && indexReachable
                && statuses.stream().allMatch(PipelineStatus::isHealthy)
                && (refresherStatus == null || refresherStatus.isHealthy());
        return SyncStatusReport.builder()
                .generatedAt(clock.instant())
                .running(running)
                .healthy(healthy)
                .sourceReachable(sourceReachable)
                .indexReachable(indexReachable)
                .pipelines(statuses)
                .refresher(refresherStatus)
                .build();
    }

    public PipelineStatus status(String sourceName) {
        return pipeline(sourceName).status();
    }

    /**
     * Compares each source's row count with its index's document count.
     */
    public List<SourceStatistics> statistics() {
        List<SourceStatistics> result = new ArrayList<>();
        for (SyncPipeline pipeline : pipelines.values()) {
            SourceConfig source = pipeline.getSource();
            SourceStatistics.SourceStatisticsBuilder stats = SourceStatistics.builder()
                    .source(source.getName())
                    .relation(source.getRelation())
                    .index(source.getIndex());
            try {
                long rows = store.countRows(source.getRelation());
                long documents = indexWriter.countDocuments(source.getIndex());
                boolean duplicates = documents > rows;
                if (duplicates) {
                    log.error("[{}] Index '{}' holds {} documents but '{}' has only {} rows",
                            source.getName(), source.getIndex(), documents, source.getRelation(), rows);
                }
                stats.rowCount(rows).documentCount(documents).duplicateSuspected(duplicates);
            } catch (IOException | RuntimeException e) {
                log.warn("[{}] Failed to collect statistics: {}", source.getName(), e.getMessage());
                stats.error(e.getMessage());
            }
            result.add(stats.build());
        }
        return result;
    }

    // ── Administrative actions ───────────────────────────────────────────

    /**
     * Forces a full resync of one source.  Safe while the pipeline is live: the reset waits
     * for the in-flight cycle and the next cycle replays from epoch as idempotent upserts.
     */
    public void resetCheckpoint(String sourceName) {
        pipeline(sourceName).resetCheckpoint();
    }

    public void resetAll() {
        pipelines.values().forEach(SyncPipeline::resetCheckpoint);
    }

    /**
     * Runs one cycle of {@code sourceName} now.  While running, the cycle is queued on the
     * pipeline's own thread so it cannot overlap a scheduled cycle; before the first start
     * it runs on the caller's thread.
     *
     * @throws IllegalStateException after {@link #stop()}
     */
    public CompletableFuture<CycleResult> triggerSync(String sourceName) {
        SyncPipeline pipeline = pipeline(sourceName);
        if (stopped) {
            throw new IllegalStateException("Sync is stopped; cannot run a cycle of '" + sourceName + "'");
        }
        ScheduledExecutorService executor = executors.get(sourceName);
        if (running && executor != null) {
            return CompletableFuture.supplyAsync(() -> runSupervised(pipeline), executor);
        }
        return CompletableFuture.completedFuture(runSupervised(pipeline));
    }

    /**
     * Resets every checkpoint and refreshes the view unconditionally.
     */
    public void fullSync() {
        log.info("Starting full synchronization of {} source(s)", pipelines.size());
        resetAll();
        if (refresher != null) {
            refresher.refresh();
        }
    }

    /**
     * @return {@code true} if the view was refreshed, {@code false} if it was already current
     * @throws IllegalStateException if no refresher is configured
     */
    public boolean refreshView() {
        if (refresher == null) {
            throw new IllegalStateException("Materialized view refresh is disabled");
        }
        return refresher.refreshIfNeeded();
    }

    private SyncPipeline pipeline(String sourceName) {
        SyncPipeline pipeline = pipelines.get(sourceName);
        if (pipeline == null) {
            throw new IllegalArgumentException("Unknown source: " + sourceName);
        }
        return pipeline;
    }

    /**
     * Scheduler whose pending delayed cycles are dropped on shutdown, so stopping never
     * waits out a backoff delay.
     */
    private static ScheduledExecutorService singleThreadScheduler(String name) {
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }
}
