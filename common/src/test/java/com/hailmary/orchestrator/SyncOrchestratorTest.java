package com.hailmary.orchestrator;

import com.hailmary.checkpoint.InMemoryCheckpointStore;
import com.hailmary.config.RefreshConfig;
import com.hailmary.config.SourceConfig;
import com.hailmary.config.SyncConfig;
import com.hailmary.model.IndexDocument;
import com.hailmary.pipeline.BackoffPolicy;
import com.hailmary.pipeline.CycleResult;
import com.hailmary.pipeline.PipelineState;
import com.hailmary.pipeline.PipelineStatus;
import com.hailmary.pipeline.SyncPipeline;
import com.hailmary.support.FakeIndexWriter;
import com.hailmary.support.InMemoryRelationalStore;
import com.hailmary.transform.ColumnCopyTransformer;
import com.hailmary.transform.DocumentTransformer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.hailmary.support.InMemoryRelationalStore.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Sync orchestrator")
class SyncOrchestratorTest {

    private static final Instant T1000 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1001 = Instant.parse("2024-05-01T10:01:00Z");

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryRelationalStore store;
    private FakeIndexWriter index;
    private InMemoryCheckpointStore checkpoints;
    private SyncConfig config;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryRelationalStore()
                .createRelation("Company", "id", "name", "updatedAt")
                .createRelation("Prospect", "id", "firstName", "updatedAt")
                .createRelation("company_prospect_view", "prospect_id", "firstName", "last_updated");
        store.upsert("Company", "id", row("id", 1L, "name", "Acme", "updatedAt", T1000));
        store.upsert("Company", "id", row("id", 2L, "name", "Globex", "updatedAt", T1001));
        store.upsert("Prospect", "id", row("id", 1L, "firstName", "Ada", "updatedAt", T1000));

        index = new FakeIndexWriter();
        checkpoints = new InMemoryCheckpointStore(clock);

        config = new SyncConfig();
        config.getRetry().setInitialDelayMs(10);
        config.getRetry().setMaxDelayMs(100);
        config.getRefresh().setEnabled(false);
        config.setSources(List.of(
                source("company", "Company", "company"),
                source("prospect", "Prospect", "prospect")));
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.stop();
        }
    }

    private static SourceConfig source(String name, String relation, String index) {
        SourceConfig source = new SourceConfig();
        source.setName(name);
        source.setRelation(relation);
        source.setTrackingColumn("updatedAt");
        source.setIndex(index);
        source.setPollIntervalMs(20);
        return source;
    }

    private SyncOrchestrator build() {
        orchestrator = SyncOrchestrator.fromConfig(config, store, index, checkpoints, clock);
        return orchestrator;
    }

    @Test
    void disabledSources_getNoPipeline() {
        config.getSources().get(1).setEnabled(false);

        SyncStatusReport report = build().status();

        assertThat(report.getPipelines()).extracting(PipelineStatus::getSource).containsExactly("company");
        assertThat(report.getRefresher()).isNull();
    }

    @Test
    void sourcesSharingAnIndex_areRejected() {
        config.getSources().get(1).setIndex("company");

        assertThatThrownBy(this::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("every source needs its own index");
    }

    @Test
    @DisplayName("A failing source leaves the others syncing and the report unhealthy")
    void failingSource_doesNotBlockOthers() throws Exception {
        build();
        store.createRelation("Prospect", "id", "firstname", "updatedat");

        CycleResult prospects = orchestrator.triggerSync("prospect").get();
        CycleResult companies = orchestrator.triggerSync("company").get();

        assertThat(prospects.getOutcome()).isEqualTo(CycleResult.Outcome.FAILED);
        assertThat(companies.isSuccess()).isTrue();
        assertThat(index.countDocuments("company")).isEqualTo(2);

        SyncStatusReport report = orchestrator.status();
        assertThat(report.isHealthy()).isFalse();
        assertThat(orchestrator.status("prospect").isConfigurationError()).isTrue();
        assertThat(orchestrator.status("company").isHealthy()).isTrue();
        assertThat(orchestrator.status("company").getLastCheckpoint()).isEqualTo(T1001);
    }

    @Test
    void unknownSource_isRejected() {
        build();

        assertThatThrownBy(() -> orchestrator.resetCheckpoint("lead"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown source: lead");
        assertThatThrownBy(() -> orchestrator.triggerSync("lead")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Forced resync of one source replays it to the same document count")
    void resetOneSource_replaysItAlone() throws Exception {
        build();
        orchestrator.triggerSync("company").get();
        orchestrator.triggerSync("prospect").get();

        orchestrator.resetCheckpoint("prospect");

        assertThat(checkpoints.get("prospect")).isEqualTo(Instant.EPOCH);
        assertThat(checkpoints.get("company")).isEqualTo(T1001);

        CycleResult replay = orchestrator.triggerSync("prospect").get();
        assertThat(replay.getRowsExtracted()).isEqualTo(1);
        assertThat(index.countDocuments("prospect")).isEqualTo(store.countRows("Prospect"));
    }

    @Test
    void statistics_flagIndexWithMoreDocumentsThanRows() throws Exception {
        build();
        orchestrator.triggerSync("company").get();
        orchestrator.triggerSync("prospect").get();
        index.bulkUpsert("prospect", List.of(
                IndexDocument.builder().documentId("stray").body(Map.of("firstName", "Ghost")).build()));

        List<SourceStatistics> statistics = orchestrator.statistics();

        assertThat(statistics).extracting(SourceStatistics::getSource).containsExactly("company", "prospect");
        SourceStatistics company = statistics.get(0);
        assertThat(company.getRowCount()).isEqualTo(2);
        assertThat(company.getDocumentCount()).isEqualTo(2);
        assertThat(company.isDuplicateSuspected()).isFalse();
        SourceStatistics prospect = statistics.get(1);
        assertThat(prospect.getRowCount()).isEqualTo(1);
        assertThat(prospect.getDocumentCount()).isEqualTo(2);
        assertThat(prospect.isDuplicateSuspected()).isTrue();
    }

    @Test
    void fullSync_resetsEveryCheckpointAndRefreshesView() throws Exception {
        config.getRefresh().setEnabled(true);
        config.getRefresh().setBaseTables(List.of(new RefreshConfig.BaseTable("Prospect", "updatedAt")));
        build();
        orchestrator.triggerSync("company").get();
        orchestrator.triggerSync("prospect").get();

        orchestrator.fullSync();

        assertThat(checkpoints.get("company")).isEqualTo(Instant.EPOCH);
        assertThat(checkpoints.get("prospect")).isEqualTo(Instant.EPOCH);
        assertThat(store.getRefreshCount()).isEqualTo(1);
        assertThat(orchestrator.status().getRefresher().getRefreshCount()).isEqualTo(1);
    }

    @Test
    void refreshView_withoutRefresher_isRejected() {
        build();

        assertThatThrownBy(() -> orchestrator.refreshView()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Started pipelines poll on their own threads until stopped")
    void startAndStop_runScheduledCycles() throws Exception {
        config.setSources(List.of(source("company", "Company", "company")));
        build();

        orchestrator.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (!T1001.equals(checkpoints.get("company")) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        orchestrator.stop();

        assertThat(checkpoints.get("company")).isEqualTo(T1001);
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(orchestrator.status("company").getState()).isEqualTo(PipelineState.STOPPED);
        assertThat(orchestrator.status().isRunning()).isFalse();
    }

    @Test
    void indexOutage_isReportedInStatistics() {
        FakeIndexWriter broken = new FakeIndexWriter() {
            @Override
            public long countDocuments(String index) {
                throw new IllegalStateException("cluster unavailable");
            }
        };
        SyncOrchestrator withBrokenIndex = SyncOrchestrator.fromConfig(config, store, broken, checkpoints, clock);

        List<SourceStatistics> statistics = withBrokenIndex.statistics();

        assertThat(statistics).allSatisfy(s -> assertThat(s.getError()).isEqualTo("cluster unavailable"));
    }

    @Test
    @DisplayName("An Error escaping a cycle is reported and the pipeline keeps polling")
    void errorInCycle_isReportedAndPollingContinues() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        DocumentTransformer flaky = record -> {
            if (calls.incrementAndGet() == 1) {
                throw new NoClassDefFoundError("com/hailmary/search/model/CompanyDocument");
            }
            return new ColumnCopyTransformer().transform(record);
        };
        SyncPipeline pipeline = new SyncPipeline(source("company", "Company", "company"), store, flaky, index,
                checkpoints, new BackoffPolicy(10, 100, 2.0), clock);
        orchestrator = new SyncOrchestrator(List.of(pipeline), null, store, index, clock);

        orchestrator.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (!T1001.equals(checkpoints.get("company")) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        orchestrator.stop();

        assertThat(calls.get()).isGreaterThan(1);
        assertThat(checkpoints.get("company")).isEqualTo(T1001);
        PipelineStatus status = orchestrator.status("company");
        assertThat(status.getErrorCount()).isEqualTo(1);
        assertThat(status.getLastError()).contains("NoClassDefFoundError");
        assertThat(index.countDocuments("company")).isEqualTo(2);
    }

    @Test
    void errorInCycle_marksPipelineUnhealthy() throws Exception {
        DocumentTransformer broken = record -> {
            throw new NoClassDefFoundError("com/hailmary/search/model/CompanyDocument");
        };
        SyncPipeline pipeline = new SyncPipeline(source("company", "Company", "company"), store, broken, index,
                checkpoints, new BackoffPolicy(10, 100, 2.0), clock);
        orchestrator = new SyncOrchestrator(List.of(pipeline), null, store, index, clock);

        CycleResult result = orchestrator.triggerSync("company").get();

        assertThat(result.getOutcome()).isEqualTo(CycleResult.Outcome.FAILED);
        PipelineStatus status = orchestrator.status("company");
        assertThat(status.getState()).isEqualTo(PipelineState.ERROR);
        assertThat(status.isHealthy()).isFalse();
        assertThat(status.isConfigurationError()).isTrue();
        assertThat(checkpoints.get("company")).isEqualTo(Instant.EPOCH);
    }

    @Test
    void status_reportsStoreReachability() {
        build();
        assertThat(orchestrator.status().isSourceReachable()).isTrue();
        assertThat(orchestrator.status().isIndexReachable()).isTrue();
        assertThat(orchestrator.status().isHealthy()).isTrue();

        index.setReachable(false);
        SyncStatusReport indexDown = orchestrator.status();
        assertThat(indexDown.isIndexReachable()).isFalse();
        assertThat(indexDown.isHealthy()).isFalse();

        index.setReachable(true);
        store.setReachable(false);
        SyncStatusReport databaseDown = orchestrator.status();
        assertThat(databaseDown.isSourceReachable()).isFalse();
        assertThat(databaseDown.isHealthy()).isFalse();
    }

    @Test
    void triggerAfterStop_isRejected() throws Exception {
        build();
        assertThat(orchestrator.triggerSync("company").get().isSuccess()).isTrue();

        orchestrator.start();
        orchestrator.stop();

        assertThatThrownBy(() -> orchestrator.triggerSync("company"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("stopped");
    }
}
