package com.hailmary.refresh;

import com.hailmary.checkpoint.InMemoryCheckpointStore;
import com.hailmary.config.RefreshConfig;
import com.hailmary.config.SourceConfig;
import com.hailmary.pipeline.BackoffPolicy;
import com.hailmary.pipeline.CycleResult;
import com.hailmary.pipeline.SyncPipeline;
import com.hailmary.support.FakeIndexWriter;
import com.hailmary.support.InMemoryRelationalStore;
import com.hailmary.transform.ColumnCopyTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.hailmary.support.InMemoryRelationalStore.row;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Materialized view refresher")
class MaterializedViewRefresherTest {

    private static final Instant T0900 = Instant.parse("2024-05-01T09:00:00Z");
    private static final Instant T0930 = Instant.parse("2024-05-01T09:30:00Z");
    private static final Instant T0931 = Instant.parse("2024-05-01T09:31:00Z");

    private final Clock clock = Clock.fixed(T0931, ZoneOffset.UTC);

    private InMemoryRelationalStore store;
    private RefreshConfig config;

    @BeforeEach
    void setUp() {
        store = new InMemoryRelationalStore()
                .createRelation("Company", "id", "name", "updatedAt")
                .createRelation("Prospect", "id", "firstName", "companyId", "updatedAt")
                .createRelation("company_prospect_view",
                        "prospect_id", "company_id", "company_name", "firstName", "last_updated");

        store.upsert("Company", "id", row("id", 10L, "name", "Acme", "updatedAt", T0900));
        store.upsert("Prospect", "id", row("id", 1L, "firstName", "Ada", "companyId", 10L, "updatedAt", T0900));
        rebuildView(T0900);

        // joins base tables, stamping every row with the refresh time
        store.defineView("company_prospect_view", s -> rebuildView(clock.instant()));

        config = new RefreshConfig();
        config.setView("company_prospect_view");
        config.setViewTrackingColumn("last_updated");
        config.setBaseTables(List.of(
                new RefreshConfig.BaseTable("Company", "updatedAt"),
                new RefreshConfig.BaseTable("Prospect", "updatedAt")));
    }

    private void rebuildView(Instant refreshedAt) {
        store.clear("company_prospect_view");
        for (Map<String, Object> prospect : store.rows("Prospect")) {
            store.upsert("company_prospect_view", "prospect_id", row(
                    "prospect_id", prospect.get("id"),
                    "company_id", prospect.get("companyId"),
                    "company_name", "Acme",
                    "firstName", prospect.get("firstName"),
                    "last_updated", refreshedAt));
        }
    }

    @Test
    @DisplayName("A base-table edit after the last refresh makes the view pipeline see new rows")
    void baseTableChange_isPickedUpByViewPipeline() {
        SourceConfig viewSource = new SourceConfig();
        viewSource.setName("company_prospect_view");
        viewSource.setRelation("company_prospect_view");
        viewSource.setPrimaryKey(List.of("prospect_id"));
        viewSource.setTrackingColumn("last_updated");
        viewSource.setIndex("company_prospect_view");
        InMemoryCheckpointStore checkpoints = new InMemoryCheckpointStore(clock);
        FakeIndexWriter index = new FakeIndexWriter();
        SyncPipeline viewPipeline = new SyncPipeline(viewSource, store, new ColumnCopyTransformer(), index,
                checkpoints, new BackoffPolicy(100, 1_000, 2.0), clock);
        viewPipeline.runCycle();
        assertThat(checkpoints.get("company_prospect_view")).isEqualTo(T0900);

        store.upsert("Prospect", "id", row("id", 1L, "firstName", "Ada L.", "companyId", 10L, "updatedAt", T0930));
        MaterializedViewRefresher refresher = new MaterializedViewRefresher(config, store, clock);

        assertThat(refresher.needsRefresh()).isTrue();
        assertThat(refresher.refreshIfNeeded()).isTrue();
        assertThat(store.maxValue("company_prospect_view", "last_updated")).contains(T0931);

        CycleResult result = viewPipeline.runCycle();

        assertThat(result.getRowsExtracted()).isEqualTo(1);
        assertThat(index.documents("company_prospect_view").get("1")).containsEntry("firstName", "Ada L.");
        assertThat(checkpoints.get("company_prospect_view")).isEqualTo(T0931);
    }

    @Test
    @DisplayName("Nothing is recomputed while the view is current")
    void currentView_isNotRefreshed() {
        MaterializedViewRefresher refresher = new MaterializedViewRefresher(config, store, clock);

        assertThat(refresher.needsRefresh()).isFalse();
        assertThat(refresher.refreshIfNeeded()).isFalse();

        assertThat(store.getRefreshCount()).isZero();
        RefresherStatus status = refresher.status();
        assertThat(status.getSkippedCount()).isEqualTo(1);
        assertThat(status.getLastCheckAt()).isEqualTo(T0931);
        assertThat(status.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Always-refresh mode skips the change check")
    void alwaysRefresh_refreshesOnEveryTick() {
        config.setAlwaysRefresh(true);
        MaterializedViewRefresher refresher = new MaterializedViewRefresher(config, store, clock);

        refresher.tick();
        refresher.tick();

        assertThat(store.getRefreshCount()).isEqualTo(2);
        assertThat(refresher.status().getRefreshCount()).isEqualTo(2);
        assertThat(refresher.status().getLastRefreshAt()).isEqualTo(T0931);
    }

    @Test
    @DisplayName("A failed refresh is recorded and retried on the next tick")
    void failedRefresh_isRecordedNotThrown() {
        store.defineView("company_prospect_view", s -> {
            throw new CannotAcquireLockException("could not obtain lock on relation company_prospect_view");
        });
        config.setAlwaysRefresh(true);
        MaterializedViewRefresher refresher = new MaterializedViewRefresher(config, store, clock);

        assertThat(refresher.tick()).isFalse();

        RefresherStatus status = refresher.status();
        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getErrorCount()).isEqualTo(1);
        assertThat(status.getLastError()).contains("could not obtain lock");

        store.defineView("company_prospect_view", s -> rebuildView(clock.instant()));
        assertThat(refresher.tick()).isTrue();
        assertThat(refresher.status().isHealthy()).isTrue();
    }

    @Test
    @DisplayName("An Error thrown by a refresh is recorded and does not end the refresh schedule")
    void errorDuringRefresh_isRecordedNotThrown() {
        store.defineView("company_prospect_view", s -> {
            throw new NoClassDefFoundError("org/postgresql/util/PSQLState");
        });
        config.setAlwaysRefresh(true);
        MaterializedViewRefresher refresher = new MaterializedViewRefresher(config, store, clock);

        assertThat(refresher.tick()).isFalse();
        assertThat(refresher.status().getErrorCount()).isEqualTo(1);
        assertThat(refresher.status().getLastError()).contains("PSQLState");

        store.defineView("company_prospect_view", s -> rebuildView(clock.instant()));
        assertThat(refresher.tick()).isTrue();
        assertThat(refresher.status().isHealthy()).isTrue();
    }
}
